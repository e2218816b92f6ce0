package com.zzf.bashnorm.cli;

import com.zzf.bashnorm.config.NormalizerProperties;
import com.zzf.bashnorm.lexicon.ArgumentTypeClassifier;
import com.zzf.bashnorm.lexicon.GrammarProfile;
import com.zzf.bashnorm.lexicon.GrammarProfileLoader;
import com.zzf.bashnorm.lexicon.LexicalClassifier;
import com.zzf.bashnorm.normalize.CommandNormalizer;
import com.zzf.bashnorm.normalize.ShellCommandNormalizer;
import com.zzf.bashnorm.preprocess.SyntaxPreprocessor;
import com.zzf.bashnorm.syntax.RecursiveDescentShellParser;
import com.zzf.bashnorm.tree.TreeJsonWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NormalizeCommandRunnerTest {

    @TempDir
    Path tempDir;

    private NormalizeCommandRunner runner;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    public void setup() {
        GrammarProfile profile = new GrammarProfileLoader().loadDefault();
        ShellCommandNormalizer normalizer = new ShellCommandNormalizer(new SyntaxPreprocessor(profile),
                new RecursiveDescentShellParser(),
                new CommandNormalizer(new LexicalClassifier(profile), new ArgumentTypeClassifier(profile)));
        runner = new NormalizeCommandRunner(normalizer, new TreeJsonWriter(), new NormalizerProperties());
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return runner.execute(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void shouldPrintDumpForAcceptedCommand() {
        assertEquals(NormalizeCommandRunner.EXIT_OK, run("find . -name x"));

        assertTrue(out().startsWith("ROOT(root)"));
        assertTrue(out().contains("    HEADCOMMAND(find)"));
        assertTrue(out().contains("        FLAG(-name)"));
    }

    @Test
    public void shouldPrintTemplateAndJson() {
        assertEquals(NormalizeCommandRunner.EXIT_OK, run("--template", "find . -name x"));
        assertEquals("find File -name Pattern", out().trim());

        out.reset();
        assertEquals(NormalizeCommandRunner.EXIT_OK, run("--json", "ls -l"));
        assertTrue(out().contains("\"kind\" : \"headcommand\""));
    }

    @Test
    public void shouldHonourDigitSwitch() {
        run("cp file1 file2");
        assertTrue(out().contains("ARGUMENT(file_NUM)"));

        out.reset();
        run("--no-digits", "cp", "file1", "file2");
        assertTrue(out().contains("ARGUMENT(file1)"));
        assertFalse(out().contains("_NUM"));
    }

    @Test
    public void shouldFailForRejectedCommand() {
        assertEquals(NormalizeCommandRunner.EXIT_FAILURE, run("ls > out.txt"));

        assertTrue(err().contains("Cannot normalize: ls > out.txt"));
        assertEquals("", out());
    }

    @Test
    public void shouldPrintUsageForMissingArguments() {
        assertEquals(NormalizeCommandRunner.EXIT_USAGE, run());
        assertTrue(err().contains("usage: bash-normalizer"));

        assertEquals(NormalizeCommandRunner.EXIT_USAGE, run("--file"));
        assertEquals(NormalizeCommandRunner.EXIT_OK, run("--help"));
        assertTrue(out().contains("usage: bash-normalizer"));
    }

    @Test
    public void shouldIgnoreSpringPropertyArguments() {
        assertEquals(NormalizeCommandRunner.EXIT_OK, run("--bashnorm.max-depth=16", "--template", "ls -l"));
        assertEquals("ls -l", out().trim());
    }

    @Test
    public void shouldNormalizeFileLineByLine() throws IOException {
        Path file = tempDir.resolve("commands.txt");
        Files.write(file, List.of("ls -l", "", "ls > out.txt", "find . -name a"), StandardCharsets.UTF_8);

        assertEquals(NormalizeCommandRunner.EXIT_OK, run("--template", "--file", file.toString()));

        List<String> lines = out().lines().toList();
        assertEquals(List.of("ls -l", "find File -name Pattern"), lines);
        assertTrue(err().contains("Skipped: ls > out.txt"));
    }

    @Test
    public void shouldFailForUnreadableFile() {
        assertEquals(NormalizeCommandRunner.EXIT_FAILURE, run("--file", tempDir.resolve("absent.txt").toString()));
        assertTrue(err().contains("Cannot read"));
    }
}
