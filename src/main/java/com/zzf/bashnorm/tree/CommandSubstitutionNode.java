package com.zzf.bashnorm.tree;

import java.util.List;
import java.util.Objects;

public record CommandSubstitutionNode(NormalizedNode command) implements NormalizedNode {

    public CommandSubstitutionNode {
        Objects.requireNonNull(command, "command");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMMAND_SUBSTITUTION;
    }

    @Override
    public String value() {
        return "";
    }

    @Override
    public List<NormalizedNode> children() {
        return List.of(command);
    }
}
