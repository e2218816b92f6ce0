package com.zzf.bashnorm.preprocess;

import com.zzf.bashnorm.lexicon.GrammarProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual fixes applied before parsing. Utilities such as {@code tar} accept their first option cluster
 * without a leading dash ({@code tar xvf a.tar}); the missing dash is inserted so that the cluster parses
 * as a flag.
 */
public final class SyntaxPreprocessor {

    private final List<BareOptionFix> fixes = new ArrayList<>();

    public SyntaxPreprocessor(GrammarProfile profile) {
        List<String> utilities = profile == null || profile.getBareOptionUtilities() == null
                ? List.of()
                : profile.getBareOptionUtilities();
        for (String utility : utilities) {
            if (utility != null && !utility.isBlank()) {
                fixes.add(new BareOptionFix(utility.trim()));
            }
        }
    }

    public String preprocess(String command) {
        if (command == null) {
            return "";
        }
        String result = command;
        for (BareOptionFix fix : fixes) {
            result = fix.apply(result);
        }
        return result;
    }

    private static final class BareOptionFix {
        private final String utility;
        private final Pattern bareCluster;

        BareOptionFix(String utility) {
            this.utility = utility;
            this.bareCluster = Pattern.compile("(^| )" + Pattern.quote(utility) + " (?=\\w)");
        }

        String apply(String command) {
            if (!command.equals(utility) && !command.startsWith(utility + " ")) {
                return command;
            }
            return bareCluster.matcher(command).replaceAll("$1" + Matcher.quoteReplacement(utility) + " -");
        }
    }
}
