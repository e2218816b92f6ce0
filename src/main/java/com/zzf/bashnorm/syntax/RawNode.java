package com.zzf.bashnorm.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A node of the raw shell parse tree.
 *
 * @param kind    node kind
 * @param value   word text with quoting removed, operator text, or reserved word
 * @param start   offset of the first source character covered by this node
 * @param end     offset one past the last source character
 * @param parts   ordered sub-parts; for words these are the expansions found inside the word
 * @param command nested command of a command or process substitution, otherwise {@code null}
 */
public record RawNode(RawKind kind, String value, int start, int end, List<RawNode> parts, RawNode command) {

    public RawNode {
        Objects.requireNonNull(kind, "kind");
        value = value == null ? "" : value;
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static RawNode leaf(RawKind kind, String value, int start, int end) {
        return new RawNode(kind, value, start, end, List.of(), null);
    }

    public static RawNode container(RawKind kind, String value, List<RawNode> parts) {
        int start = parts.isEmpty() ? 0 : parts.get(0).start();
        int end = parts.isEmpty() ? 0 : parts.get(parts.size() - 1).end();
        return new RawNode(kind, value, start, end, parts, null);
    }

    public boolean hasParts() {
        return !parts.isEmpty();
    }

    /**
     * Width of the source text this node was read from. Quoting makes it wider than {@link #value()}.
     */
    public int spanWidth() {
        return end - start;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.tag()).append('(');
        if (!value.isEmpty()) {
            sb.append('\'').append(value).append('\'');
        }
        for (RawNode part : parts) {
            sb.append(sb.charAt(sb.length() - 1) == '(' ? "" : ", ").append(part);
        }
        if (command != null) {
            sb.append(sb.charAt(sb.length() - 1) == '(' ? "" : ", ").append("command=").append(command);
        }
        return sb.append(')').toString();
    }
}
