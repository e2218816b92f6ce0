package com.zzf.bashnorm.lexicon;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token predicates backed by one {@link GrammarProfile}. Immutable after construction and safe to share.
 */
public final class LexicalClassifier {
    private final Set<String> headCommands;
    private final Set<String> unaryLogicOperators;
    private final Set<String> binaryLogicOperators;
    private final Pattern digitPattern;
    private final String numberPlaceholder;
    private final int maxDepth;

    public LexicalClassifier(GrammarProfile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("profile is null");
        }
        this.headCommands = copyOf(profile.getHeadCommands());
        this.unaryLogicOperators = copyOf(profile.getUnaryLogicOperators());
        this.binaryLogicOperators = copyOf(profile.getBinaryLogicOperators());
        this.digitPattern = Pattern.compile(profile.getDigitPattern() == null ? "\\d+" : profile.getDigitPattern());
        this.numberPlaceholder = profile.getNumberPlaceholder() == null ? "_NUM" : profile.getNumberPlaceholder();
        this.maxDepth = profile.getMaxDepth() > 0 ? profile.getMaxDepth() : 64;
    }

    public boolean isOption(String word) {
        return word != null && word.length() > 1 && word.charAt(0) == '-';
    }

    public boolean isHeadCommand(String word) {
        return word != null && headCommands.contains(word);
    }

    public boolean isUnaryLogicOperator(String word) {
        return word != null && unaryLogicOperators.contains(word);
    }

    public boolean isBinaryLogicOperator(String word) {
        return word != null && binaryLogicOperators.contains(word);
    }

    /**
     * Replaces every digit run with the placeholder. Option tokens are returned unchanged.
     */
    public String canonicalizeDigits(String word, boolean enabled) {
        if (!enabled || word == null || isOption(word)) {
            return word;
        }
        return digitPattern.matcher(word).replaceAll(Matcher.quoteReplacement(numberPlaceholder));
    }

    public String numberPlaceholder() {
        return numberPlaceholder;
    }

    public int maxDepth() {
        return maxDepth;
    }

    private static Set<String> copyOf(Collection<String> values) {
        if (values == null) {
            return Set.of();
        }
        Set<String> out = new HashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return Set.copyOf(out);
    }
}
