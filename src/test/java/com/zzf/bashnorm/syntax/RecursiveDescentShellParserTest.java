package com.zzf.bashnorm.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RecursiveDescentShellParserTest {

    private final RecursiveDescentShellParser parser = new RecursiveDescentShellParser();

    private RawNode single(String text) {
        List<RawNode> roots = parser.parse(text);
        assertEquals(1, roots.size());
        return roots.get(0);
    }

    @Test
    public void shouldParseSimpleCommandWithSpans() {
        RawNode command = single("ls -l /tmp");

        assertEquals(RawKind.COMMAND, command.kind());
        assertEquals(3, command.parts().size());
        RawNode flag = command.parts().get(1);
        assertEquals(RawKind.WORD, flag.kind());
        assertEquals("-l", flag.value());
        assertEquals(3, flag.start());
        assertEquals(5, flag.end());
        assertEquals(0, command.start());
        assertEquals(10, command.end());
    }

    @Test
    public void shouldStripQuotesButKeepSourceSpan() {
        RawNode command = single("echo \"a b\" 'ls'");

        RawNode doubleQuoted = command.parts().get(1);
        assertEquals("a b", doubleQuoted.value());
        assertEquals(5, doubleQuoted.spanWidth());

        RawNode singleQuoted = command.parts().get(2);
        assertEquals("ls", singleQuoted.value());
        assertEquals(4, singleQuoted.spanWidth());
    }

    @Test
    public void shouldKeepEscapedSemicolonAsWord() {
        RawNode command = single("find . -exec rm {} \\;");

        RawNode last = command.parts().get(command.parts().size() - 1);
        assertEquals(RawKind.WORD, last.kind());
        assertEquals(";", last.value());
        assertEquals(2, last.spanWidth());
    }

    @Test
    public void shouldParsePipelineAsAlternatingParts() {
        RawNode pipeline = single("ls -l | grep foo | wc -l");

        assertEquals(RawKind.PIPELINE, pipeline.kind());
        assertEquals(5, pipeline.parts().size());
        assertEquals(RawKind.COMMAND, pipeline.parts().get(0).kind());
        assertEquals(RawKind.PIPE, pipeline.parts().get(1).kind());
        assertEquals(RawKind.COMMAND, pipeline.parts().get(4).kind());
    }

    @Test
    public void shouldParseListsWithOperators() {
        RawNode list = single("make && make install");
        assertEquals(RawKind.LIST, list.kind());
        assertEquals(3, list.parts().size());
        assertEquals(RawKind.OPERATOR, list.parts().get(1).kind());
        assertEquals("&&", list.parts().get(1).value());

        RawNode trailing = single("ls ;");
        assertEquals(RawKind.LIST, trailing.kind());
        assertEquals(2, trailing.parts().size());
        assertEquals(";", trailing.parts().get(1).value());
    }

    @Test
    public void shouldAttachNestedCommandToCommandSubstitution() {
        RawNode command = single("echo $(ls -a)");

        RawNode word = command.parts().get(1);
        assertEquals("$(ls -a)", word.value());
        assertEquals(1, word.parts().size());
        RawNode substitution = word.parts().get(0);
        assertEquals(RawKind.COMMAND_SUBSTITUTION, substitution.kind());
        assertNotNull(substitution.command());
        assertEquals(RawKind.COMMAND, substitution.command().kind());
        RawNode nestedHead = substitution.command().parts().get(0);
        assertEquals("ls", nestedHead.value());
        assertEquals(7, nestedHead.start());
    }

    @Test
    public void shouldTreatBackquotesAsCommandSubstitution() {
        RawNode word = single("echo `date`").parts().get(1);

        assertEquals(RawKind.COMMAND_SUBSTITUTION, word.parts().get(0).kind());
        assertEquals("date", word.parts().get(0).command().parts().get(0).value());
    }

    @Test
    public void shouldParseProcessSubstitutionWord() {
        RawNode command = single("diff <(ls a) >(wc -l)");

        RawNode input = command.parts().get(1);
        assertEquals("<(ls a)", input.value());
        assertEquals(RawKind.PROCESS_SUBSTITUTION, input.parts().get(0).kind());
        RawNode output = command.parts().get(2);
        assertEquals(RawKind.PROCESS_SUBSTITUTION, output.parts().get(0).kind());
        assertEquals("wc", output.parts().get(0).command().parts().get(0).value());
    }

    @Test
    public void shouldRecordParameterAndTildeParts() {
        RawNode command = single("cp $HOME/a ~/b");

        assertEquals(RawKind.PARAMETER, command.parts().get(1).parts().get(0).kind());
        assertEquals("HOME", command.parts().get(1).parts().get(0).value());
        assertEquals(RawKind.TILDE, command.parts().get(2).parts().get(0).kind());
    }

    @Test
    public void shouldParseRedirectionsAndAssignments() {
        RawNode command = single("LANG=C sort < in.txt > out.txt");

        assertEquals(RawKind.ASSIGNMENT, command.parts().get(0).kind());
        assertEquals(RawKind.WORD, command.parts().get(1).kind());
        RawNode redirect = command.parts().get(2);
        assertEquals(RawKind.REDIRECT, redirect.kind());
        assertEquals("<", redirect.value());
        assertEquals("in.txt", redirect.parts().get(0).value());
        assertEquals(RawKind.REDIRECT, command.parts().get(3).kind());
    }

    @Test
    public void shouldParseCompoundConstructs() {
        assertEquals(RawKind.COMPOUND, single("(cd /tmp && ls)").kind());
        assertEquals(RawKind.FUNCTION, single("f() { ls; }").kind());
        assertEquals(RawKind.FUNCTION, single("function f { ls; }").kind());
        assertEquals(RawKind.IF, single("if true; then ls; fi").kind());
        assertEquals(RawKind.FOR, single("for f in a b; do echo $f; done").kind());
        assertEquals(RawKind.WHILE, single("while true; do ls; done").kind());
        assertEquals(RawKind.UNTIL, single("until false; do ls; done").kind());
    }

    @Test
    public void shouldKeepSubshellParenthesesAsReservedWords() {
        RawNode subshell = single("(ls -l)");

        assertEquals(RawKind.RESERVED_WORD, subshell.parts().get(0).kind());
        assertEquals(RawKind.COMMAND, subshell.parts().get(1).kind());
        assertEquals(RawKind.RESERVED_WORD, subshell.parts().get(2).kind());
    }

    @Test
    public void shouldReturnOneRootPerLine() {
        List<RawNode> roots = parser.parse("ls\nwc -l");

        assertEquals(2, roots.size());
        assertEquals("wc", roots.get(1).parts().get(0).value());
    }

    @Test
    public void shouldIgnoreComments() {
        RawNode command = single("ls -l # list files");

        assertEquals(2, command.parts().size());
    }

    @Test
    public void shouldRejectMalformedInput() {
        assertReason(ShellParseException.Reason.MATCHED_PAIR, "echo 'unterminated");
        assertReason(ShellParseException.Reason.MATCHED_PAIR, "echo \"unterminated");
        assertReason(ShellParseException.Reason.MATCHED_PAIR, "echo $(ls");
        assertReason(ShellParseException.Reason.MATCHED_PAIR, "ls )");
        assertReason(ShellParseException.Reason.PARSING_ERROR, "ls |");
        assertReason(ShellParseException.Reason.PARSING_ERROR, "ls &&");
        assertReason(ShellParseException.Reason.PARSING_ERROR, "if true; then ls");
    }

    @Test
    public void shouldRejectUnsupportedGrammar() {
        assertReason(ShellParseException.Reason.NOT_IMPLEMENTED, "echo $((1 + 2))");
        assertReason(ShellParseException.Reason.NOT_IMPLEMENTED, "case x in a) ls;; esac");
        assertReason(ShellParseException.Reason.NOT_IMPLEMENTED, "! ls");
    }

    @Test
    public void shouldRejectEmptyAndCommentOnlyInput() {
        assertReason(ShellParseException.Reason.EMPTY_INPUT, "   ");
        assertReason(ShellParseException.Reason.EMPTY_INPUT, null);
        assertReason(ShellParseException.Reason.NOT_A_COMMAND, "# just a comment");
    }

    @Test
    public void shouldBoundNestingDepth() {
        RecursiveDescentShellParser shallow = new RecursiveDescentShellParser(2);

        ShellParseException e = assertThrows(ShellParseException.class,
                () -> shallow.parse("echo $(echo $(echo $(ls)))"));
        assertEquals(ShellParseException.Reason.PARSING_ERROR, e.getReason());
        assertTrue(e.getMessage().contains("nested deeper"));
    }

    private void assertReason(ShellParseException.Reason expected, String text) {
        ShellParseException e = assertThrows(ShellParseException.class, () -> parser.parse(text));
        assertEquals(expected, e.getReason(), () -> "input: " + text);
    }
}
