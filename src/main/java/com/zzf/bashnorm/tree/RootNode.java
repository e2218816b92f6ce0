package com.zzf.bashnorm.tree;

import java.util.List;

public record RootNode(List<NormalizedNode> children) implements NormalizedNode {

    public RootNode {
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ROOT;
    }

    @Override
    public String value() {
        return "root";
    }
}
