package com.zzf.bashnorm.cli;

import com.zzf.bashnorm.config.NormalizerProperties;
import com.zzf.bashnorm.normalize.ShellCommandNormalizer;
import com.zzf.bashnorm.tree.RootNode;
import com.zzf.bashnorm.tree.TreeDumper;
import com.zzf.bashnorm.tree.TreeJsonWriter;
import com.zzf.bashnorm.tree.TreeLinearizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code bash-normalizer [--json] [--template] [--no-digits] <command>} or
 * {@code bash-normalizer [--json] [--template] [--no-digits] --file <path>}.
 */
@Slf4j
@Component
public class NormalizeCommandRunner implements CommandLineRunner, ExitCodeGenerator {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "usage: bash-normalizer [--json] [--template] [--no-digits] <command>",
            "       bash-normalizer [--json] [--template] [--no-digits] --file <path>");

    private final ShellCommandNormalizer normalizer;
    private final TreeJsonWriter jsonWriter;
    private final NormalizerProperties properties;

    private int exitCode = EXIT_OK;

    public NormalizeCommandRunner(ShellCommandNormalizer normalizer, TreeJsonWriter jsonWriter, NormalizerProperties properties) {
        this.normalizer = normalizer;
        this.jsonWriter = jsonWriter;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args, System.out, System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String[] args, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args, properties.isNormalizeDigits());
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (options.help) {
            out.println(USAGE);
            return EXIT_OK;
        }
        if (options.file != null) {
            return normalizeFile(options, out, err);
        }
        if (options.command.isBlank()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Optional<RootNode> tree = normalizer.normalize(options.command, options.normalizeDigits);
        if (tree.isEmpty()) {
            err.println("Cannot normalize: " + options.command);
            return EXIT_FAILURE;
        }
        out.println(render(tree.get(), options));
        return EXIT_OK;
    }

    private int normalizeFile(Options options, PrintStream out, PrintStream err) {
        List<String> lines;
        try {
            lines = Files.readAllLines(Paths.get(options.file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read commands from {}", options.file, e);
            err.println("Cannot read " + options.file + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        List<String> commands = new ArrayList<>();
        for (String line : lines) {
            if (!line.isBlank()) {
                commands.add(line);
            }
        }
        ShellCommandNormalizer.BatchResult result = normalizer.normalizeAll(commands, options.normalizeDigits);
        for (ShellCommandNormalizer.NormalizedCommand accepted : result.accepted()) {
            out.println(render(accepted.tree(), options));
        }
        for (String skipped : result.skipped()) {
            err.println("Skipped: " + skipped);
        }
        return EXIT_OK;
    }

    private String render(RootNode tree, Options options) {
        if (options.json) {
            return jsonWriter.write(tree, options.file == null);
        }
        if (options.template) {
            return TreeLinearizer.toTemplate(tree);
        }
        return TreeDumper.dump(tree).stripTrailing();
    }

    private static final class Options {
        private boolean json;
        private boolean template;
        private boolean help;
        private boolean normalizeDigits;
        private String file;
        private String command = "";

        static Options parse(String[] args, boolean normalizeDigits) {
            Options options = new Options();
            options.normalizeDigits = normalizeDigits;
            List<String> words = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!words.isEmpty()) {
                    words.add(arg);
                    continue;
                }
                switch (arg) {
                    case "--json" -> options.json = true;
                    case "--template" -> options.template = true;
                    case "--no-digits" -> options.normalizeDigits = false;
                    case "--help", "-h" -> options.help = true;
                    case "--file" -> {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("--file needs a path");
                        }
                        options.file = args[++i];
                    }
                    default -> {
                        // Spring property overrides such as --bashnorm.max-depth=32
                        if (arg.startsWith("--") && arg.contains("=")) {
                            continue;
                        }
                        words.add(arg);
                    }
                }
            }
            if (options.file != null && !words.isEmpty()) {
                throw new IllegalArgumentException("give either a command or --file, not both");
            }
            options.command = String.join(" ", words);
            return options;
        }
    }
}
