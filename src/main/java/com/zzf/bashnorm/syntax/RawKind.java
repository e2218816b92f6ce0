package com.zzf.bashnorm.syntax;

/**
 * Node kinds of the raw shell parse tree.
 */
public enum RawKind {
    WORD("word"),
    PIPELINE("pipeline"),
    PIPE("pipe"),
    LIST("list"),
    OPERATOR("operator"),
    COMMAND("command"),
    COMPOUND("compound"),
    RESERVED_WORD("reservedword"),
    COMMAND_SUBSTITUTION("commandsubstitution"),
    PROCESS_SUBSTITUTION("processsubstitution"),
    PARAMETER("parameter"),
    TILDE("tilde"),
    REDIRECT("redirect"),
    HEREDOC("heredoc"),
    ASSIGNMENT("assignment"),
    FUNCTION("function"),
    IF("if"),
    FOR("for"),
    WHILE("while"),
    UNTIL("until");

    private final String tag;

    RawKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
