package com.zzf.bashnorm.tree;

/**
 * Indented debug dump, one {@code KIND(value)} line per node and four spaces per level. Not a stable format.
 */
public final class TreeDumper {
    private static final String INDENT = "    ";

    private TreeDumper() {}

    public static String dump(NormalizedNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node, 0);
        return sb.toString();
    }

    private static void append(StringBuilder sb, NormalizedNode node, int depth) {
        sb.append(INDENT.repeat(depth))
                .append(node.kind().tag().toUpperCase())
                .append('(').append(node.value()).append(')')
                .append('\n');
        for (NormalizedNode child : node.children()) {
            append(sb, child, depth + 1);
        }
    }
}
