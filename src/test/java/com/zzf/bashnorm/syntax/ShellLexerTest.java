package com.zzf.bashnorm.syntax;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ShellLexerTest {

    private static List<ShellToken> tokenize(String text) {
        return new ShellLexer(text, 0, 0, (nested, offset, depth) -> RawNode.leaf(RawKind.COMMAND, nested, offset, offset + nested.length()))
                .tokenize();
    }

    private static List<ShellTokenType> types(String text) {
        List<ShellTokenType> types = new ArrayList<>();
        for (ShellToken token : tokenize(text)) {
            types.add(token.type());
        }
        return types;
    }

    @Test
    public void shouldSplitOperators() {
        assertEquals(List.of(ShellTokenType.WORD, ShellTokenType.PIPE, ShellTokenType.WORD, ShellTokenType.AND_IF,
                        ShellTokenType.WORD, ShellTokenType.OR_IF, ShellTokenType.WORD, ShellTokenType.SEMI,
                        ShellTokenType.WORD, ShellTokenType.AMP, ShellTokenType.EOF),
                types("a | b && c || d ; e &"));
    }

    @Test
    public void shouldReadFileDescriptorRedirects() {
        List<ShellToken> tokens = tokenize("ls 2>err.log");

        assertEquals(ShellTokenType.REDIRECT, tokens.get(1).type());
        assertEquals("2>", tokens.get(1).text());
        assertEquals("err.log", tokens.get(2).value());
    }

    @Test
    public void shouldNotTreatDigitsInsideWordsAsRedirects() {
        List<ShellToken> tokens = tokenize("cp file1 file2");

        assertEquals(4, tokens.size());
        assertEquals("file1", tokens.get(1).value());
    }

    @Test
    public void shouldJoinAdjacentQuotedSegments() {
        ShellToken token = tokenize("a'b c'\"d\"").get(0);

        assertEquals("ab cd", token.value());
        assertEquals("a'b c'\"d\"", token.text());
        assertFalse(token.isPlainWord());
    }

    @Test
    public void shouldReportAbsoluteOffsets() {
        ShellToken token = new ShellLexer("ls -l", 10, 1, (nested, offset, depth) -> null).tokenize().get(1);

        assertEquals(13, token.start());
        assertEquals(15, token.end());
        assertTrue(token.isPlainWord("-l"));
    }
}
