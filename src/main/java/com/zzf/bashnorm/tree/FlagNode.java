package com.zzf.bashnorm.tree;

import java.util.List;
import java.util.Objects;

/**
 * An option token with whatever value arguments or embedded commands follow it.
 */
public record FlagNode(String name, List<NormalizedNode> children) implements NormalizedNode {

    public FlagNode {
        Objects.requireNonNull(name, "name");
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FLAG;
    }

    @Override
    public String value() {
        return name;
    }
}
