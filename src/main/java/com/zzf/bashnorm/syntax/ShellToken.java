package com.zzf.bashnorm.syntax;

import java.util.List;

/**
 * @param type  token type
 * @param text  source text of the token
 * @param value text with quotes and escaping backslashes removed; equal to {@code text} for operators
 * @param start source offset of the first character
 * @param end   source offset one past the last character
 * @param parts expansions found inside a word
 */
record ShellToken(ShellTokenType type, String text, String value, int start, int end, List<RawNode> parts) {

    ShellToken {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    static ShellToken operator(ShellTokenType type, String text, int start) {
        return new ShellToken(type, text, text, start, start + text.length(), List.of());
    }

    boolean isWord() {
        return type == ShellTokenType.WORD;
    }

    /**
     * A word written without any quoting or escaping.
     */
    boolean isPlainWord() {
        return type == ShellTokenType.WORD && text.equals(value);
    }

    boolean isPlainWord(String word) {
        return isPlainWord() && value.equals(word);
    }

    @Override
    public String toString() {
        return String.format("Token[Type=%-8s, Text='%s', Position=%d:%d]", type, text, start, end);
    }
}
