package com.zzf.bashnorm.lexicon;

import com.zzf.bashnorm.tree.ArgumentType;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classification tables for one shell grammar profile. Loaded from JSON, see {@link GrammarProfileLoader}.
 */
@Data
public class GrammarProfile {
    private List<String> headCommands = new ArrayList<>();
    private List<String> unaryLogicOperators = new ArrayList<>(List.of("!", "-not"));
    private List<String> binaryLogicOperators = new ArrayList<>(List.of("-and", "-or", "||", "&&", "-o"));
    private String digitPattern = "\\d+";
    private String numberPlaceholder = "_NUM";
    private List<String> bareOptionUtilities = new ArrayList<>(List.of("tar"));
    private Map<String, ArgumentType> flagArgumentTypes = new LinkedHashMap<>();
    private int maxDepth = 64;
}
