package com.zzf.bashnorm.tree;

import java.util.List;
import java.util.Objects;

public record UnaryLogicOpNode(String operator, NormalizedNode operand) implements NormalizedNode {

    public UnaryLogicOpNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_LOGIC_OP;
    }

    @Override
    public String value() {
        return operator;
    }

    @Override
    public List<NormalizedNode> children() {
        return List.of(operand);
    }
}
