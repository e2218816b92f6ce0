package com.zzf.bashnorm.normalize;

import com.zzf.bashnorm.lexicon.ArgumentTypeClassifier;
import com.zzf.bashnorm.lexicon.LexicalClassifier;
import com.zzf.bashnorm.syntax.RawKind;
import com.zzf.bashnorm.syntax.RawNode;
import com.zzf.bashnorm.tree.ArgumentType;
import com.zzf.bashnorm.tree.NodeKind;
import com.zzf.bashnorm.tree.RootNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts one raw shell parse tree into the normalized command grammar.
 *
 * <p>The conversion is a single top-down pass that appends nodes under a moving attach point, followed
 * by a post-pass per command body that moves logic-operator operands under their operators. Any
 * violation aborts the whole conversion with a {@link NormalizationException}; no partial tree escapes.
 *
 * <p>Instances hold only immutable lookup tables, so one normalizer may serve concurrent callers.
 */
@Slf4j
public class CommandNormalizer {
    private static final String END_OF_OPTIONS = "--";
    private static final String END_OF_COMMAND = ";";

    private final LexicalClassifier lexicon;
    private final ArgumentTypeClassifier argumentTypes;

    public CommandNormalizer(LexicalClassifier lexicon, ArgumentTypeClassifier argumentTypes) {
        if (lexicon == null || argumentTypes == null) {
            throw new IllegalArgumentException("lexicon and argument type classifier are required");
        }
        this.lexicon = lexicon;
        this.argumentTypes = argumentTypes;
    }

    public RootNode normalize(RawNode raw, boolean normalizeDigits) {
        if (raw == null) {
            throw new IllegalArgumentException("raw node is null");
        }
        Conversion conversion = new Conversion(normalizeDigits);
        conversion.dispatch(raw, TreeBuilder.ROOT, Role.ARGUMENT, 0);
        return conversion.builder.build();
    }

    /**
     * What a plain word becomes when it is emitted as a leaf.
     */
    private enum Role {
        HEAD_COMMAND(NodeKind.HEAD_COMMAND),
        FLAG(NodeKind.FLAG),
        ARGUMENT(NodeKind.ARGUMENT);

        private final NodeKind kind;

        Role(NodeKind kind) {
            this.kind = kind;
        }
    }

    /**
     * State of one call. Never shared between calls.
     */
    private final class Conversion {
        private final TreeBuilder builder = new TreeBuilder();
        private final boolean normalizeDigits;

        Conversion(boolean normalizeDigits) {
            this.normalizeDigits = normalizeDigits;
        }

        void dispatch(RawNode node, int current, Role role, int depth) {
            if (depth > lexicon.maxDepth()) {
                throw new StructuralException(StructuralException.Reason.DEPTH_EXCEEDED,
                        "input nested deeper than " + lexicon.maxDepth() + " levels");
            }
            switch (node.kind()) {
                case WORD -> word(node, current, role, depth);
                case PIPELINE -> pipeline(node, current, depth);
                case LIST -> list(node, current, depth);
                case COMMAND_SUBSTITUTION, PROCESS_SUBSTITUTION -> substitution(node, current, depth);
                case COMMAND -> commandBody(node, current, depth);
                case COMPOUND -> {
                    for (RawNode part : node.parts()) {
                        dispatch(part, current, role, depth + 1);
                    }
                }
                case RESERVED_WORD, PIPE -> log.debug("Skipping separator {}", node);
                case OPERATOR, PARAMETER, TILDE, REDIRECT, HEREDOC, ASSIGNMENT, FUNCTION, IF, FOR, WHILE, UNTIL ->
                        throw new UnsupportedConstructException(node.kind());
            }
        }

        private void word(RawNode word, int current, Role role, int depth) {
            if (word.hasParts() && word.parts().get(0).kind() != RawKind.TILDE) {
                RawNode first = word.parts().get(0);
                switch (first.kind()) {
                    case PROCESS_SUBSTITUTION -> {
                        String direction = word.value().contains(">") ? ">" : "<";
                        int substitution = builder.attach(current, NodeKind.PROCESS_SUBSTITUTION, direction);
                        for (RawNode part : word.parts()) {
                            dispatch(part, substitution, role, depth + 1);
                        }
                    }
                    case COMMAND_SUBSTITUTION -> {
                        int substitution = builder.attach(current, NodeKind.COMMAND_SUBSTITUTION, "");
                        for (RawNode part : word.parts()) {
                            dispatch(part, substitution, role, depth + 1);
                        }
                    }
                    case PARAMETER -> leaf(word, current, role);
                    default -> {
                        for (RawNode part : word.parts()) {
                            dispatch(part, current, role, depth + 1);
                        }
                    }
                }
                return;
            }
            leaf(word, current, role);
        }

        private void leaf(RawNode word, int current, Role role) {
            String text = word.value();
            String value = lexicon.canonicalizeDigits(text, normalizeDigits);
            if (role == Role.HEAD_COMMAND) {
                builder.attach(current, NodeKind.HEAD_COMMAND, value);
                return;
            }
            if (role == Role.FLAG) {
                builder.attach(current, NodeKind.FLAG, value);
                return;
            }
            String enclosingFlag = builder.kindOf(current) == NodeKind.FLAG ? builder.valueOf(current) : null;
            ArgumentType type = argumentTypes.classify(text, enclosingFlag);
            builder.attach(current, role.kind, value, type);
        }

        private void pipeline(RawNode node, int current, int depth) {
            List<RawNode> parts = node.parts();
            if (parts.size() % 2 == 0) {
                throw new StructuralException(StructuralException.Reason.MALFORMED_PIPELINE,
                        "pipeline must have an odd number of parts but has " + parts.size());
            }
            int pipeline = builder.attach(current, NodeKind.PIPELINE, "");
            for (int i = 0; i < parts.size(); i++) {
                RawNode part = parts.get(i);
                RawKind expected = i % 2 == 0 ? RawKind.COMMAND : RawKind.PIPE;
                if (part.kind() != expected) {
                    throw new StructuralException(StructuralException.Reason.MALFORMED_PIPELINE,
                            "expected " + expected.tag() + " at pipeline position " + i + " but found " + part.kind().tag());
                }
                if (expected == RawKind.COMMAND) {
                    dispatch(part, pipeline, Role.ARGUMENT, depth + 1);
                }
            }
        }

        private void list(RawNode node, int current, int depth) {
            if (node.parts().size() > 2) {
                throw new UnsupportedConstructException(RawKind.LIST,
                        "Unsupported: list of " + node.parts().size() + " parts");
            }
            for (RawNode part : node.parts()) {
                if (part.kind() == RawKind.OPERATOR) {
                    continue;
                }
                dispatch(part, current, Role.ARGUMENT, depth + 1);
            }
        }

        private void substitution(RawNode node, int current, int depth) {
            if (node.command() == null) {
                throw new StructuralException(StructuralException.Reason.ARITY_VIOLATION,
                        node.kind().tag() + " without a command");
            }
            dispatch(node.command(), current, Role.ARGUMENT, depth + 1);
        }

        private void commandBody(RawNode command, int current, int depth) {
            int cursor = current;
            boolean endOfOptions = false;
            boolean endOfCommand = false;
            List<Integer> unaryOperators = new ArrayList<>();
            List<Integer> binaryOperators = new ArrayList<>();

            for (RawNode part : command.parts()) {
                if (endOfCommand) {
                    cursor = closeScope(cursor);
                    endOfCommand = false;
                    endOfOptions = false;
                }
                if (part.kind() != RawKind.WORD) {
                    throw new UnsupportedConstructException(part.kind());
                }
                String word = part.value();
                if (END_OF_OPTIONS.equals(word) && !endOfOptions) {
                    endOfOptions = true;
                } else if (END_OF_COMMAND.equals(word)) {
                    endOfCommand = true;
                } else if (!endOfOptions && lexicon.isUnaryLogicOperator(word)) {
                    cursor = resolveAttachPoint(cursor, word);
                    unaryOperators.add(builder.attach(cursor, NodeKind.UNARY_LOGIC_OP, word));
                } else if (!endOfOptions && lexicon.isBinaryLogicOperator(word)) {
                    cursor = resolveAttachPoint(cursor, word);
                    binaryOperators.add(builder.attach(cursor, NodeKind.BINARY_LOGIC_OP, word));
                } else if (lexicon.isHeadCommand(word) && part.spanWidth() == word.length()) {
                    dispatch(part, cursor, Role.HEAD_COMMAND, depth + 1);
                    cursor = builder.lastChildOf(cursor);
                } else if (!endOfOptions && lexicon.isOption(word)) {
                    cursor = resolveAttachPoint(cursor, word);
                    dispatch(part, cursor, Role.FLAG, depth + 1);
                    cursor = builder.lastChildOf(cursor);
                } else {
                    dispatch(part, cursor, Role.ARGUMENT, depth + 1);
                }
            }
            absorbOperands(unaryOperators, binaryOperators);
        }

        /**
         * Leaves the utility closed by {@code ;}, together with the flag that introduced it.
         */
        private int closeScope(int cursor) {
            int scope = builder.kindOf(cursor) == NodeKind.FLAG ? builder.parentOf(cursor) : cursor;
            int parent = builder.parentOf(scope);
            if (parent == TreeBuilder.NONE) {
                throw new StructuralException(StructuralException.Reason.COMPOUND_COMMAND,
                        "';' closes no nested utility");
            }
            if (builder.kindOf(parent) == NodeKind.FLAG) {
                return builder.parentOf(parent);
            }
            if (builder.kindOf(parent) == NodeKind.HEAD_COMMAND) {
                return parent;
            }
            throw new StructuralException(StructuralException.Reason.COMPOUND_COMMAND,
                    "';' after " + builder.kindOf(scope).tag() + " '" + builder.valueOf(scope)
                            + "' leaves a " + builder.kindOf(parent).tag() + " scope");
        }

        private int resolveAttachPoint(int cursor, String token) {
            NodeKind kind = builder.kindOf(cursor);
            if (kind == NodeKind.FLAG) {
                return builder.parentOf(cursor);
            }
            if (kind == NodeKind.HEAD_COMMAND) {
                return cursor;
            }
            throw new StructuralException(StructuralException.Reason.AMBIGUOUS_ATTACHMENT,
                    "cannot attach '" + token + "' under " + kind.tag());
        }

        private void absorbOperands(List<Integer> unaryOperators, List<Integer> binaryOperators) {
            // right to left, so that stacked negations each take the one after them
            for (int i = unaryOperators.size() - 1; i >= 0; i--) {
                int operator = unaryOperators.get(i);
                int operand = builder.rightSiblingOf(operator);
                if (operand == TreeBuilder.NONE) {
                    throw new StructuralException(StructuralException.Reason.MISSING_OPERAND,
                            "'" + builder.valueOf(operator) + "' has no operand");
                }
                builder.reparent(operand, operator);
            }
            for (int operator : binaryOperators) {
                int left = builder.leftSiblingOf(operator);
                int right = builder.rightSiblingOf(operator);
                if (left == TreeBuilder.NONE || right == TreeBuilder.NONE) {
                    throw new StructuralException(StructuralException.Reason.MISSING_OPERAND,
                            "'" + builder.valueOf(operator) + "' needs a left and a right operand");
                }
                builder.reparent(left, operator);
                builder.reparent(right, operator);
            }
        }
    }
}
