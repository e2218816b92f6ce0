package com.zzf.bashnorm.tree;

import java.util.List;
import java.util.Objects;

public record BinaryLogicOpNode(String operator, NormalizedNode left, NormalizedNode right) implements NormalizedNode {

    public BinaryLogicOpNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_LOGIC_OP;
    }

    @Override
    public String value() {
        return operator;
    }

    @Override
    public List<NormalizedNode> children() {
        return List.of(left, right);
    }
}
