package com.zzf.bashnorm.lexicon;

import com.zzf.bashnorm.tree.ArgumentType;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Assigns a fine-grained type to an argument value. A type registered for the enclosing flag wins;
 * otherwise the value's shape decides.
 */
public final class ArgumentTypeClassifier {
    private static final Pattern NUMBER = Pattern.compile("[+-]?\\d+");
    private static final Pattern SIZE = Pattern.compile("[+-]?\\d+[ckMGTP]");
    private static final Pattern TIME = Pattern.compile("[+-]?\\d+[smhdw]");
    private static final Pattern SYMBOLIC_MODE = Pattern.compile("[ugoa]*[-+=][rwxXst]+(,[ugoa]*[-+=][rwxXst]+)*");
    private static final Pattern GLOB = Pattern.compile(".*[*?\\[].*");
    private static final Pattern FILE_EXTENSION = Pattern.compile("[^\\s]*[^.\\s/]\\.[A-Za-z0-9]{1,8}");

    private final Map<String, ArgumentType> flagArgumentTypes;

    public ArgumentTypeClassifier(GrammarProfile profile) {
        this.flagArgumentTypes = profile == null || profile.getFlagArgumentTypes() == null
                ? Map.of()
                : Map.copyOf(profile.getFlagArgumentTypes());
    }

    public ArgumentType classify(String value, String enclosingFlag) {
        if (enclosingFlag != null) {
            ArgumentType byFlag = flagArgumentTypes.get(enclosingFlag);
            if (byFlag != null) {
                return byFlag;
            }
        }
        if (value == null || value.isEmpty()) {
            return ArgumentType.UNKNOWN;
        }
        if (NUMBER.matcher(value).matches()) {
            return ArgumentType.NUMBER;
        }
        if (SIZE.matcher(value).matches()) {
            return ArgumentType.SIZE;
        }
        if (TIME.matcher(value).matches()) {
            return ArgumentType.TIME;
        }
        if (SYMBOLIC_MODE.matcher(value).matches()) {
            return ArgumentType.PERMISSION;
        }
        if (GLOB.matcher(value).matches()) {
            return ArgumentType.PATTERN;
        }
        if (looksLikePath(value)) {
            return ArgumentType.FILE;
        }
        return ArgumentType.UNKNOWN;
    }

    private static boolean looksLikePath(String value) {
        if (".".equals(value) || "..".equals(value) || value.startsWith("~")) {
            return true;
        }
        if (value.indexOf('/') >= 0) {
            return true;
        }
        return FILE_EXTENSION.matcher(value).matches();
    }
}
