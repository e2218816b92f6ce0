package com.zzf.bashnorm.normalize;

import com.zzf.bashnorm.preprocess.SyntaxPreprocessor;
import com.zzf.bashnorm.syntax.RawNode;
import com.zzf.bashnorm.syntax.ShellParseException;
import com.zzf.bashnorm.syntax.ShellParser;
import com.zzf.bashnorm.tree.RootNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Entry point that turns command text into a normalized tree. Never throws for bad input: every parse or
 * normalization failure is logged and reported as an empty result, so batch callers can skip the line.
 */
@Slf4j
public class ShellCommandNormalizer {

    private final SyntaxPreprocessor preprocessor;
    private final ShellParser parser;
    private final CommandNormalizer normalizer;

    public ShellCommandNormalizer(SyntaxPreprocessor preprocessor, ShellParser parser, CommandNormalizer normalizer) {
        this.preprocessor = preprocessor;
        this.parser = parser;
        this.normalizer = normalizer;
    }

    public Optional<RootNode> normalize(String command, boolean normalizeDigits) {
        if (command == null) {
            return Optional.empty();
        }
        String prepared = preprocessor.preprocess(command.replace('\r', ' ').replace('\n', ' ').trim()).trim();
        if (prepared.isEmpty()) {
            log.debug("Skipping empty command");
            return Optional.empty();
        }

        List<RawNode> roots;
        try {
            roots = parser.parse(prepared);
        } catch (ShellParseException e) {
            log.warn("Cannot parse: {} - {}: {}", prepared, e.getReason(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Cannot parse: {} - {}", prepared, e.toString());
            return Optional.empty();
        }
        if (roots == null || roots.isEmpty()) {
            log.warn("Cannot parse: {} - no command found", prepared);
            return Optional.empty();
        }
        if (roots.size() > 1) {
            log.warn("Command has {} root nodes, only the first is normalized: {}", roots.size(), prepared);
        }

        try {
            RootNode tree = normalizer.normalize(roots.get(0), normalizeDigits);
            log.debug("Normalized {} into {} top-level node(s)", prepared, tree.children().size());
            return Optional.of(tree);
        } catch (NormalizationException e) {
            log.warn("{} - {} [{}]", e.getMessage(), prepared, e.category());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Unexpected failure while normalizing: {}", prepared, e);
            return Optional.empty();
        }
    }

    /**
     * Normalizes every command, keeping the accepted ones in input order.
     */
    public BatchResult normalizeAll(Iterable<String> commands, boolean normalizeDigits) {
        List<NormalizedCommand> accepted = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        if (commands != null) {
            for (String command : commands) {
                Optional<RootNode> tree = normalize(command, normalizeDigits);
                if (tree.isPresent()) {
                    accepted.add(new NormalizedCommand(command, tree.get()));
                } else {
                    skipped.add(command);
                }
            }
        }
        log.info("Normalized {} command(s), skipped {}", accepted.size(), skipped.size());
        return new BatchResult(accepted, skipped);
    }

    public record NormalizedCommand(String command, RootNode tree) {
    }

    public record BatchResult(List<NormalizedCommand> accepted, List<String> skipped) {

        public BatchResult {
            accepted = List.copyOf(accepted);
            skipped = Collections.unmodifiableList(new ArrayList<>(skipped));
        }
    }
}
