package com.zzf.bashnorm.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for the part of the shell grammar that command lines use: simple commands,
 * pipelines, lists, subshells and groups, if/for/while/until blocks, function definitions, redirections
 * and word expansions. Constructs it does not model fail with
 * {@link ShellParseException.Reason#NOT_IMPLEMENTED}.
 *
 * <p>Every newline-separated top-level command becomes its own root.
 */
public class RecursiveDescentShellParser implements ShellParser {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final Set<String> CLOSING_WORDS = Set.of("then", "elif", "else", "fi", "do", "done", "esac", "}");
    private static final Set<String> UNSUPPORTED_KEYWORDS = Set.of("case", "select", "coproc");
    private static final Pattern ASSIGNMENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\[[^\\]]*\\])?\\+?=.*", Pattern.DOTALL);
    private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.:-]*");

    private final int maxDepth;

    public RecursiveDescentShellParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    public RecursiveDescentShellParser(int maxDepth) {
        this.maxDepth = maxDepth > 0 ? maxDepth : DEFAULT_MAX_DEPTH;
    }

    @Override
    public List<RawNode> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ShellParseException(ShellParseException.Reason.EMPTY_INPUT, "empty command");
        }
        List<RawNode> roots = parseText(text, 0, 0);
        if (roots.isEmpty()) {
            throw new ShellParseException(ShellParseException.Reason.NOT_A_COMMAND, "no command found in input");
        }
        return roots;
    }

    private List<RawNode> parseText(String text, int offset, int depth) {
        if (depth > maxDepth) {
            throw new ShellParseException(ShellParseException.Reason.PARSING_ERROR,
                    "substitutions nested deeper than " + maxDepth, offset);
        }
        List<ShellToken> tokens = new ShellLexer(text, offset, depth, this::parseNested).tokenize();
        return new Session(tokens, depth).parseScript();
    }

    private RawNode parseNested(String text, int offset, int depth) {
        if (text.isBlank()) {
            throw new ShellParseException(ShellParseException.Reason.PARSING_ERROR, "empty substitution", offset);
        }
        List<RawNode> roots = parseText(text, offset, depth);
        if (roots.isEmpty()) {
            throw new ShellParseException(ShellParseException.Reason.PARSING_ERROR, "substitution without a command", offset);
        }
        if (roots.size() > 1) {
            throw new ShellParseException(ShellParseException.Reason.NOT_IMPLEMENTED,
                    "multi-line substitution is not supported", offset);
        }
        return roots.get(0);
    }

    /**
     * Parse state over one token stream.
     */
    private final class Session {
        private final List<ShellToken> tokens;
        private final int baseDepth;
        private int position = 0;
        private int nesting = 0;

        Session(List<ShellToken> tokens, int baseDepth) {
            this.tokens = tokens;
            this.baseDepth = baseDepth;
        }

        List<RawNode> parseScript() {
            List<RawNode> roots = new ArrayList<>();
            skipNewlines();
            while (!check(ShellTokenType.EOF)) {
                roots.add(parseList());
                if (!check(ShellTokenType.EOF) && !check(ShellTokenType.NEWLINE)) {
                    throw unexpected(peek());
                }
                skipNewlines();
            }
            return roots;
        }

        private RawNode parseList() {
            List<RawNode> parts = new ArrayList<>();
            parts.add(parsePipeline());
            while (checkListOperator()) {
                ShellToken operator = advance();
                parts.add(RawNode.leaf(RawKind.OPERATOR, operator.value(), operator.start(), operator.end()));
                if (operator.type() == ShellTokenType.AND_IF || operator.type() == ShellTokenType.OR_IF) {
                    skipNewlines();
                    parts.add(parsePipeline());
                } else if (startsCommand(peek())) {
                    parts.add(parsePipeline());
                } else {
                    break;
                }
            }
            return parts.size() == 1 ? parts.get(0) : RawNode.container(RawKind.LIST, "", parts);
        }

        private RawNode parsePipeline() {
            if (peek().isPlainWord("!")) {
                throw new ShellParseException(ShellParseException.Reason.NOT_IMPLEMENTED,
                        "pipeline negation is not supported", peek().start());
            }
            List<RawNode> parts = new ArrayList<>();
            parts.add(parseCommand());
            while (check(ShellTokenType.PIPE) || check(ShellTokenType.PIPE_AMP)) {
                ShellToken pipe = advance();
                parts.add(RawNode.leaf(RawKind.PIPE, pipe.value(), pipe.start(), pipe.end()));
                skipNewlines();
                parts.add(parseCommand());
            }
            return parts.size() == 1 ? parts.get(0) : RawNode.container(RawKind.PIPELINE, "", parts);
        }

        private RawNode parseCommand() {
            enter();
            try {
                ShellToken token = peek();
                if (token.type() == ShellTokenType.LPAREN) {
                    ShellToken next = peekAt(1);
                    if (next.type() == ShellTokenType.LPAREN && next.start() == token.end()) {
                        throw new ShellParseException(ShellParseException.Reason.NOT_IMPLEMENTED,
                                "arithmetic command is not supported", token.start());
                    }
                    return withRedirects(parseSubshell());
                }
                if (token.isPlainWord()) {
                    String word = token.value();
                    if (UNSUPPORTED_KEYWORDS.contains(word)) {
                        throw new ShellParseException(ShellParseException.Reason.NOT_IMPLEMENTED,
                                "'" + word + "' is not supported", token.start());
                    }
                    if (CLOSING_WORDS.contains(word)) {
                        throw unexpected(token);
                    }
                    switch (word) {
                        case "{":
                            return withRedirects(parseGroup());
                        case "if":
                            return withRedirects(parseIf());
                        case "for":
                            return withRedirects(parseFor());
                        case "while":
                            return withRedirects(parseLoop(RawKind.WHILE));
                        case "until":
                            return withRedirects(parseLoop(RawKind.UNTIL));
                        case "function":
                            return parseFunction(true);
                        default:
                            break;
                    }
                    if (FUNCTION_NAME.matcher(word).matches()
                            && peekAt(1).type() == ShellTokenType.LPAREN
                            && peekAt(2).type() == ShellTokenType.RPAREN) {
                        return parseFunction(false);
                    }
                }
                if (token.isWord() || token.type() == ShellTokenType.REDIRECT) {
                    return parseSimpleCommand();
                }
                throw unexpected(token);
            } finally {
                nesting--;
            }
        }

        private RawNode parseSimpleCommand() {
            List<RawNode> parts = new ArrayList<>();
            boolean sawWord = false;
            while (true) {
                ShellToken token = peek();
                if (token.isWord()) {
                    advance();
                    if (!sawWord && ASSIGNMENT.matcher(token.text()).matches()) {
                        parts.add(new RawNode(RawKind.ASSIGNMENT, token.value(), token.start(), token.end(), token.parts(), null));
                    } else {
                        parts.add(wordNode(token));
                        sawWord = true;
                    }
                } else if (token.type() == ShellTokenType.REDIRECT) {
                    parts.add(parseRedirect());
                } else {
                    break;
                }
            }
            return RawNode.container(RawKind.COMMAND, "", parts);
        }

        private RawNode parseRedirect() {
            ShellToken operator = advance();
            if (!peek().isWord()) {
                throw new ShellParseException(ShellParseException.Reason.PARSING_ERROR,
                        "missing target after redirection '" + operator.text() + "'", operator.start());
            }
            ShellToken target = advance();
            String op = operator.text().replaceFirst("^[0-9]+", "");
            if ("<<".equals(op) || "<<-".equals(op)) {
                return new RawNode(RawKind.HEREDOC, target.value(), operator.start(), target.end(),
                        List.of(wordNode(target)), null);
            }
            return new RawNode(RawKind.REDIRECT, operator.text(), operator.start(), target.end(),
                    List.of(wordNode(target)), null);
        }

        private RawNode parseSubshell() {
            List<RawNode> parts = new ArrayList<>();
            parts.add(reserved(advance()));
            parts.addAll(parseCompoundList(Set.of(), true));
            if (!check(ShellTokenType.RPAREN)) {
                throw new ShellParseException(ShellParseException.Reason.MATCHED_PAIR,
                        "unexpected EOF while looking for matching `)'", parts.get(0).start());
            }
            parts.add(reserved(advance()));
            return RawNode.container(RawKind.COMPOUND, "", parts);
        }

        private RawNode parseGroup() {
            List<RawNode> parts = new ArrayList<>();
            parts.add(reserved(advance()));
            parts.addAll(parseCompoundList(Set.of("}"), false));
            parts.add(expectReserved("}"));
            return RawNode.container(RawKind.COMPOUND, "", parts);
        }

        private RawNode parseIf() {
            List<RawNode> parts = new ArrayList<>();
            parts.add(reserved(advance()));
            parts.addAll(parseCompoundList(Set.of("then"), false));
            parts.add(expectReserved("then"));
            parts.addAll(parseCompoundList(Set.of("elif", "else", "fi"), false));
            while (peek().isPlainWord("elif")) {
                parts.add(reserved(advance()));
                parts.addAll(parseCompoundList(Set.of("then"), false));
                parts.add(expectReserved("then"));
                parts.addAll(parseCompoundList(Set.of("elif", "else", "fi"), false));
            }
            if (peek().isPlainWord("else")) {
                parts.add(reserved(advance()));
                parts.addAll(parseCompoundList(Set.of("fi"), false));
            }
            parts.add(expectReserved("fi"));
            return RawNode.container(RawKind.IF, "", parts);
        }

        private RawNode parseFor() {
            List<RawNode> parts = new ArrayList<>();
            parts.add(reserved(advance()));
            if (check(ShellTokenType.LPAREN)) {
                throw new ShellParseException(ShellParseException.Reason.NOT_IMPLEMENTED,
                        "arithmetic for loop is not supported", peek().start());
            }
            if (!peek().isWord()) {
                throw unexpected(peek());
            }
            parts.add(wordNode(advance()));
            skipNewlines();
            if (peek().isPlainWord("in")) {
                parts.add(reserved(advance()));
                while (peek().isWord()) {
                    parts.add(wordNode(advance()));
                }
            }
            if (check(ShellTokenType.SEMI)) {
                parts.add(reserved(advance()));
            }
            skipNewlines();
            parts.add(expectReserved("do"));
            parts.addAll(parseCompoundList(Set.of("done"), false));
            parts.add(expectReserved("done"));
            return RawNode.container(RawKind.FOR, "", parts);
        }

        private RawNode parseLoop(RawKind kind) {
            List<RawNode> parts = new ArrayList<>();
            parts.add(reserved(advance()));
            parts.addAll(parseCompoundList(Set.of("do"), false));
            parts.add(expectReserved("do"));
            parts.addAll(parseCompoundList(Set.of("done"), false));
            parts.add(expectReserved("done"));
            return RawNode.container(kind, "", parts);
        }

        private RawNode parseFunction(boolean keyword) {
            List<RawNode> parts = new ArrayList<>();
            if (keyword) {
                parts.add(reserved(advance()));
                if (!peek().isWord()) {
                    throw unexpected(peek());
                }
            }
            parts.add(wordNode(advance()));
            if (check(ShellTokenType.LPAREN)) {
                advance();
                if (!check(ShellTokenType.RPAREN)) {
                    throw unexpected(peek());
                }
                advance();
            }
            skipNewlines();
            parts.add(parseCommand());
            return RawNode.container(RawKind.FUNCTION, "", parts);
        }

        /**
         * Commands of a compound body up to (not including) one of the closing words.
         */
        private List<RawNode> parseCompoundList(Set<String> closingWords, boolean closedByParenthesis) {
            List<RawNode> items = new ArrayList<>();
            int startedAt = peek().start();
            while (true) {
                skipNewlines();
                ShellToken token = peek();
                if (token.type() == ShellTokenType.EOF
                        || (closedByParenthesis && token.type() == ShellTokenType.RPAREN)
                        || (token.isPlainWord() && closingWords.contains(token.value()))) {
                    break;
                }
                items.add(parseList());
                ShellToken after = peek();
                boolean closes = after.type() == ShellTokenType.NEWLINE
                        || after.type() == ShellTokenType.EOF
                        || (closedByParenthesis && after.type() == ShellTokenType.RPAREN)
                        || (after.isPlainWord() && closingWords.contains(after.value()));
                if (!closes) {
                    throw unexpected(after);
                }
            }
            if (items.isEmpty()) {
                throw new ShellParseException(ShellParseException.Reason.PARSING_ERROR, "empty command list", startedAt);
            }
            return items;
        }

        private RawNode withRedirects(RawNode compound) {
            if (!check(ShellTokenType.REDIRECT)) {
                return compound;
            }
            List<RawNode> parts = new ArrayList<>(compound.parts());
            while (check(ShellTokenType.REDIRECT)) {
                parts.add(parseRedirect());
            }
            return new RawNode(compound.kind(), compound.value(), compound.start(), parts.get(parts.size() - 1).end(), parts, null);
        }

        private RawNode expectReserved(String word) {
            ShellToken token = peek();
            if (!token.isPlainWord(word)) {
                if (token.type() == ShellTokenType.EOF) {
                    throw new ShellParseException(ShellParseException.Reason.PARSING_ERROR,
                            "unexpected end of input, expected '" + word + "'", token.start());
                }
                throw new ShellParseException(ShellParseException.Reason.PARSING_ERROR,
                        "expected '" + word + "' but found '" + token.text() + "'", token.start());
            }
            return reserved(advance());
        }

        private boolean checkListOperator() {
            ShellTokenType type = peek().type();
            return type == ShellTokenType.SEMI || type == ShellTokenType.AMP
                    || type == ShellTokenType.AND_IF || type == ShellTokenType.OR_IF;
        }

        private boolean startsCommand(ShellToken token) {
            if (token.type() == ShellTokenType.LPAREN || token.type() == ShellTokenType.REDIRECT) {
                return true;
            }
            return token.isWord() && !(token.isPlainWord() && CLOSING_WORDS.contains(token.value()));
        }

        private ShellParseException unexpected(ShellToken token) {
            if (token.type() == ShellTokenType.EOF) {
                return new ShellParseException(ShellParseException.Reason.PARSING_ERROR,
                        "unexpected end of input", token.start());
            }
            if (token.type() == ShellTokenType.RPAREN) {
                return new ShellParseException(ShellParseException.Reason.MATCHED_PAIR,
                        "unexpected token `)'", token.start());
            }
            return new ShellParseException(ShellParseException.Reason.PARSING_ERROR,
                    "unexpected token `" + token.text().replace("\n", "\\n") + "'", token.start());
        }

        private void enter() {
            nesting++;
            if (baseDepth + nesting > maxDepth) {
                throw new ShellParseException(ShellParseException.Reason.PARSING_ERROR,
                        "commands nested deeper than " + maxDepth, peek().start());
            }
        }

        private RawNode wordNode(ShellToken token) {
            return new RawNode(RawKind.WORD, token.value(), token.start(), token.end(), token.parts(), null);
        }

        private RawNode reserved(ShellToken token) {
            return RawNode.leaf(RawKind.RESERVED_WORD, token.value(), token.start(), token.end());
        }

        private void skipNewlines() {
            while (check(ShellTokenType.NEWLINE)) {
                advance();
            }
        }

        private boolean check(ShellTokenType type) {
            return peek().type() == type;
        }

        private ShellToken advance() {
            ShellToken token = peek();
            if (token.type() != ShellTokenType.EOF) {
                position++;
            }
            return token;
        }

        private ShellToken peek() {
            return tokens.get(position);
        }

        private ShellToken peekAt(int ahead) {
            int index = Math.min(position + ahead, tokens.size() - 1);
            return tokens.get(index);
        }
    }
}
