package com.zzf.bashnorm.tree;

import java.util.List;
import java.util.Objects;

/**
 * @param direction {@code "<"} when the nested command's output is read, {@code ">"} when it is written to
 */
public record ProcessSubstitutionNode(String direction, NormalizedNode command) implements NormalizedNode {

    public ProcessSubstitutionNode {
        if (!"<".equals(direction) && !">".equals(direction)) {
            throw new IllegalArgumentException("process substitution direction must be '<' or '>': " + direction);
        }
        Objects.requireNonNull(command, "command");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROCESS_SUBSTITUTION;
    }

    @Override
    public String value() {
        return direction;
    }

    @Override
    public List<NormalizedNode> children() {
        return List.of(command);
    }
}
