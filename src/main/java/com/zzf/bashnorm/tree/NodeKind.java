package com.zzf.bashnorm.tree;

/**
 * Node kinds of the normalized command grammar together with their arity constraints.
 * An arity of {@code -1} means any number of children.
 */
public enum NodeKind {
    ROOT("root", -1),
    PIPELINE("pipeline", -1),
    HEAD_COMMAND("headcommand", -1),
    UNARY_LOGIC_OP("unarylogicop", 1),
    BINARY_LOGIC_OP("binarylogicop", 2),
    FLAG("flag", -1),
    ARGUMENT("argument", 0),
    COMMAND_SUBSTITUTION("commandsubstitution", 1),
    PROCESS_SUBSTITUTION("processsubstitution", 1);

    private final String tag;
    private final int arity;

    NodeKind(String tag, int arity) {
        this.tag = tag;
        this.arity = arity;
    }

    public String tag() {
        return tag;
    }

    public int arity() {
        return arity;
    }

    public boolean isFixedArity() {
        return arity >= 0;
    }

    /**
     * Whether a node of this kind may hold a child of the given kind.
     */
    public boolean accepts(NodeKind child) {
        return switch (this) {
            case ROOT -> child != ROOT;
            case PIPELINE, COMMAND_SUBSTITUTION, PROCESS_SUBSTITUTION -> child == HEAD_COMMAND
                    || (this != PIPELINE && child == PIPELINE);
            case HEAD_COMMAND -> child != ROOT && child != PIPELINE;
            case FLAG -> child == ARGUMENT
                    || child == HEAD_COMMAND
                    || child == COMMAND_SUBSTITUTION
                    || child == PROCESS_SUBSTITUTION;
            case UNARY_LOGIC_OP, BINARY_LOGIC_OP -> isOperand(child);
            case ARGUMENT -> false;
        };
    }

    private static boolean isOperand(NodeKind kind) {
        return kind == FLAG || kind == UNARY_LOGIC_OP || kind == BINARY_LOGIC_OP;
    }
}
