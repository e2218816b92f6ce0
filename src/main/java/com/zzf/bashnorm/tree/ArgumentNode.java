package com.zzf.bashnorm.tree;

import java.util.List;
import java.util.Objects;

public record ArgumentNode(String value, ArgumentType type) implements NormalizedNode {

    public ArgumentNode {
        Objects.requireNonNull(value, "value");
        type = type == null ? ArgumentType.UNKNOWN : type;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARGUMENT;
    }

    @Override
    public List<NormalizedNode> children() {
        return List.of();
    }
}
