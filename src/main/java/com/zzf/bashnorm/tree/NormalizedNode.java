package com.zzf.bashnorm.tree;

import java.util.List;

/**
 * A node of the normalized command tree. Trees are immutable once returned by the normalizer.
 */
public interface NormalizedNode {

    NodeKind kind();

    /**
     * Literal payload: operator text, flag text, argument text or substitution direction.
     */
    String value();

    List<NormalizedNode> children();

    default boolean isLeaf() {
        return children().isEmpty();
    }
}
