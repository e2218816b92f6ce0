package com.zzf.bashnorm.tree;

import java.util.List;
import java.util.Objects;

public record HeadCommandNode(String name, List<NormalizedNode> children) implements NormalizedNode {

    public HeadCommandNode {
        Objects.requireNonNull(name, "name");
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HEAD_COMMAND;
    }

    @Override
    public String value() {
        return name;
    }
}
