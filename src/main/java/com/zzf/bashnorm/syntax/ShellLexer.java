package com.zzf.bashnorm.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits shell text into words and operators. Expansions found inside a word (parameters, command and
 * process substitutions, a leading tilde) are recorded as word parts; substitutions are parsed on the
 * spot through {@link NestedParser} so that every part carries its nested command.
 */
final class ShellLexer {

    interface NestedParser {
        RawNode parse(String text, int offset, int depth);
    }

    private static final String[] LESS_OPERATORS = {"<<<", "<<-", "<<", "<&", "<>", "<"};
    private static final String[] GREATER_OPERATORS = {">>", ">&", ">|", ">"};
    private static final String SPECIAL_PARAMETERS = "?$#@*!-";

    private final String input;
    private final int baseOffset;
    private final int depth;
    private final NestedParser nestedParser;
    private int position = 0;

    ShellLexer(String input, int baseOffset, int depth, NestedParser nestedParser) {
        this.input = input == null ? "" : input;
        this.baseOffset = baseOffset;
        this.depth = depth;
        this.nestedParser = nestedParser;
    }

    List<ShellToken> tokenize() {
        List<ShellToken> tokens = new ArrayList<>();
        ShellToken token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != ShellTokenType.EOF);
        return tokens;
    }

    private ShellToken nextToken() {
        skipBlanks();
        if (isAtEnd()) {
            return ShellToken.operator(ShellTokenType.EOF, "", abs(position));
        }
        char c = peek();
        if (c == '#') {
            skipComment();
            return nextToken();
        }
        switch (c) {
            case '\n':
                return consume(ShellTokenType.NEWLINE, "\n");
            case '|':
                if (peekAt(1) == '&') {
                    return consume(ShellTokenType.PIPE_AMP, "|&");
                }
                if (peekAt(1) == '|') {
                    return consume(ShellTokenType.OR_IF, "||");
                }
                return consume(ShellTokenType.PIPE, "|");
            case '&':
                if (peekAt(1) == '&') {
                    return consume(ShellTokenType.AND_IF, "&&");
                }
                if (peekAt(1) == '>') {
                    return consume(ShellTokenType.REDIRECT, peekAt(2) == '>' ? "&>>" : "&>");
                }
                return consume(ShellTokenType.AMP, "&");
            case ';':
                if (peekAt(1) == ';') {
                    return consume(ShellTokenType.DSEMI, ";;");
                }
                return consume(ShellTokenType.SEMI, ";");
            case '(':
                return consume(ShellTokenType.LPAREN, "(");
            case ')':
                return consume(ShellTokenType.RPAREN, ")");
            case '<':
            case '>':
                if (peekAt(1) == '(') {
                    return readWord();
                }
                return readRedirect(position, position);
            default:
                break;
        }
        if (isDigit(c)) {
            int j = position;
            while (j < input.length() && isDigit(input.charAt(j))) {
                j++;
            }
            if (j < input.length() && (input.charAt(j) == '<' || input.charAt(j) == '>')
                    && (j + 1 >= input.length() || input.charAt(j + 1) != '(')) {
                return readRedirect(position, j);
            }
        }
        return readWord();
    }

    private ShellToken readRedirect(int start, int operatorStart) {
        String[] candidates = input.charAt(operatorStart) == '<' ? LESS_OPERATORS : GREATER_OPERATORS;
        for (String candidate : candidates) {
            if (input.startsWith(candidate, operatorStart)) {
                position = operatorStart + candidate.length();
                String text = input.substring(start, position);
                return new ShellToken(ShellTokenType.REDIRECT, text, text, abs(start), abs(position), List.of());
            }
        }
        throw new ShellParseException(ShellParseException.Reason.PARSING_ERROR,
                "unrecognized redirection operator", abs(operatorStart));
    }

    private ShellToken readWord() {
        int start = position;
        StringBuilder value = new StringBuilder();
        List<RawNode> parts = new ArrayList<>();
        while (!isAtEnd()) {
            char c = peek();
            if (position == start && (c == '<' || c == '>') && peekAt(1) == '(') {
                readProcessSubstitution(value, parts);
                continue;
            }
            if (isMetaCharacter(c)) {
                break;
            }
            switch (c) {
                case '\\':
                    readEscape(value);
                    break;
                case '\'':
                    readSingleQuoted(value);
                    break;
                case '"':
                    readDoubleQuoted(value, parts);
                    break;
                case '$':
                    readDollar(value, parts, false);
                    break;
                case '`':
                    readBackquoted(value, parts);
                    break;
                case '~':
                    if (position == start) {
                        readTilde(value, parts);
                    } else {
                        value.append(c);
                        position++;
                    }
                    break;
                default:
                    value.append(c);
                    position++;
                    break;
            }
        }
        String text = input.substring(start, position);
        return new ShellToken(ShellTokenType.WORD, text, value.toString(), abs(start), abs(position), parts);
    }

    private void readEscape(StringBuilder value) {
        position++;
        if (isAtEnd()) {
            value.append('\\');
            return;
        }
        char escaped = peek();
        position++;
        if (escaped != '\n') {
            value.append(escaped);
        }
    }

    private void readSingleQuoted(StringBuilder value) {
        int open = position;
        int close = input.indexOf('\'', open + 1);
        if (close < 0) {
            throw new ShellParseException(ShellParseException.Reason.MATCHED_PAIR,
                    "unexpected EOF while looking for matching `''", abs(open));
        }
        value.append(input, open + 1, close);
        position = close + 1;
    }

    private void readDoubleQuoted(StringBuilder value, List<RawNode> parts) {
        int open = position;
        position++;
        while (true) {
            if (isAtEnd()) {
                throw new ShellParseException(ShellParseException.Reason.MATCHED_PAIR,
                        "unexpected EOF while looking for matching `\"'", abs(open));
            }
            char c = peek();
            if (c == '"') {
                position++;
                return;
            }
            if (c == '\\') {
                char next = peekAt(1);
                if (next == '$' || next == '`' || next == '"' || next == '\\') {
                    value.append(next);
                    position += 2;
                } else if (next == '\n') {
                    position += 2;
                } else {
                    value.append(c);
                    position++;
                }
            } else if (c == '$') {
                readDollar(value, parts, true);
            } else if (c == '`') {
                readBackquoted(value, parts);
            } else {
                value.append(c);
                position++;
            }
        }
    }

    private void readDollar(StringBuilder value, List<RawNode> parts, boolean insideDoubleQuotes) {
        int start = position;
        char next = peekAt(1);
        if (next == '(') {
            if (peekAt(2) == '(') {
                throw new ShellParseException(ShellParseException.Reason.NOT_IMPLEMENTED,
                        "arithmetic expansion is not supported", abs(start));
            }
            int close = findClosingParenthesis(start + 2, start);
            RawNode command = nestedParser.parse(input.substring(start + 2, close), abs(start + 2), depth + 1);
            String text = input.substring(start, close + 1);
            parts.add(new RawNode(RawKind.COMMAND_SUBSTITUTION, text, abs(start), abs(close + 1), List.of(), command));
            value.append(text);
            position = close + 1;
            return;
        }
        if (next == '{') {
            int close = findClosingBrace(start + 2, start);
            String text = input.substring(start, close + 1);
            parts.add(RawNode.leaf(RawKind.PARAMETER, input.substring(start + 2, close), abs(start), abs(close + 1)));
            value.append(text);
            position = close + 1;
            return;
        }
        if (!insideDoubleQuotes && next == '\'') {
            position++;
            readAnsiCQuoted(value);
            return;
        }
        if (!insideDoubleQuotes && next == '"') {
            // locale translation quoting, read as plain double quotes
            position++;
            return;
        }
        if (Character.isLetter(next) || next == '_') {
            int end = start + 1;
            while (end < input.length() && (Character.isLetterOrDigit(input.charAt(end)) || input.charAt(end) == '_')) {
                end++;
            }
            addParameter(value, parts, start, end);
            return;
        }
        if (isDigit(next) || (next != 0 && SPECIAL_PARAMETERS.indexOf(next) >= 0)) {
            addParameter(value, parts, start, start + 2);
            return;
        }
        value.append('$');
        position++;
    }

    private void addParameter(StringBuilder value, List<RawNode> parts, int start, int end) {
        parts.add(RawNode.leaf(RawKind.PARAMETER, input.substring(start + 1, end), abs(start), abs(end)));
        value.append(input, start, end);
        position = end;
    }

    private void readAnsiCQuoted(StringBuilder value) {
        int open = position;
        int i = open + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\' && i + 1 < input.length()) {
                value.append(c).append(input.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '\'') {
                position = i + 1;
                return;
            }
            value.append(c);
            i++;
        }
        throw new ShellParseException(ShellParseException.Reason.MATCHED_PAIR,
                "unexpected EOF while looking for matching `''", abs(open));
    }

    private void readBackquoted(StringBuilder value, List<RawNode> parts) {
        int start = position;
        StringBuilder inner = new StringBuilder();
        int i = start + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\' && i + 1 < input.length()) {
                char next = input.charAt(i + 1);
                if (next == '`' || next == '$' || next == '\\') {
                    inner.append(next);
                    i += 2;
                    continue;
                }
            }
            if (c == '`') {
                break;
            }
            inner.append(c);
            i++;
        }
        if (i >= input.length()) {
            throw new ShellParseException(ShellParseException.Reason.MATCHED_PAIR,
                    "unexpected EOF while looking for matching ``'", abs(start));
        }
        RawNode command = nestedParser.parse(inner.toString(), abs(start + 1), depth + 1);
        String text = input.substring(start, i + 1);
        parts.add(new RawNode(RawKind.COMMAND_SUBSTITUTION, text, abs(start), abs(i + 1), List.of(), command));
        value.append(text);
        position = i + 1;
    }

    private void readProcessSubstitution(StringBuilder value, List<RawNode> parts) {
        int start = position;
        int close = findClosingParenthesis(start + 2, start);
        RawNode command = nestedParser.parse(input.substring(start + 2, close), abs(start + 2), depth + 1);
        String text = input.substring(start, close + 1);
        parts.add(new RawNode(RawKind.PROCESS_SUBSTITUTION, text, abs(start), abs(close + 1), List.of(), command));
        value.append(text);
        position = close + 1;
    }

    private void readTilde(StringBuilder value, List<RawNode> parts) {
        int start = position;
        int end = start + 1;
        while (end < input.length()) {
            char c = input.charAt(end);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == '+') {
                end++;
            } else {
                break;
            }
        }
        String text = input.substring(start, end);
        parts.add(RawNode.leaf(RawKind.TILDE, text, abs(start), abs(end)));
        value.append(text);
        position = end;
    }

    /**
     * Index of the parenthesis closing the one just before {@code from}, skipping quoted text.
     */
    private int findClosingParenthesis(int from, int openedAt) {
        int nesting = 1;
        int i = from;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '\'' || c == '"' || c == '`') {
                i = skipQuoted(i, openedAt);
                continue;
            }
            if (c == '(') {
                nesting++;
            } else if (c == ')') {
                nesting--;
                if (nesting == 0) {
                    return i;
                }
            }
            i++;
        }
        throw new ShellParseException(ShellParseException.Reason.MATCHED_PAIR,
                "unexpected EOF while looking for matching `)'", abs(openedAt));
    }

    private int findClosingBrace(int from, int openedAt) {
        int nesting = 1;
        int i = from;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '\'' || c == '"' || c == '`') {
                i = skipQuoted(i, openedAt);
                continue;
            }
            if (c == '{') {
                nesting++;
            } else if (c == '}') {
                nesting--;
                if (nesting == 0) {
                    return i;
                }
            }
            i++;
        }
        throw new ShellParseException(ShellParseException.Reason.MATCHED_PAIR,
                "unexpected EOF while looking for matching `}'", abs(openedAt));
    }

    /**
     * Returns the index just after the quoted section starting at {@code quoteAt}.
     */
    private int skipQuoted(int quoteAt, int openedAt) {
        char quote = input.charAt(quoteAt);
        int i = quoteAt + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\' && quote != '\'') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        throw new ShellParseException(ShellParseException.Reason.MATCHED_PAIR,
                "unexpected EOF while looking for matching `" + quote + "'", abs(openedAt));
    }

    private void skipBlanks() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                position++;
            } else if (c == '\\' && peekAt(1) == '\n') {
                position += 2;
            } else {
                return;
            }
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') {
            position++;
        }
    }

    private ShellToken consume(ShellTokenType type, String text) {
        ShellToken token = ShellToken.operator(type, text, abs(position));
        position += text.length();
        return token;
    }

    private static boolean isMetaCharacter(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n'
                || c == '|' || c == '&' || c == ';' || c == '(' || c == ')' || c == '<' || c == '>';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return position >= input.length();
    }

    private char peek() {
        return input.charAt(position);
    }

    private char peekAt(int ahead) {
        int index = position + ahead;
        return index < input.length() ? input.charAt(index) : 0;
    }

    private int abs(int index) {
        return baseOffset + index;
    }
}
