package com.zzf.bashnorm.config;

import com.zzf.bashnorm.lexicon.ArgumentTypeClassifier;
import com.zzf.bashnorm.lexicon.GrammarProfile;
import com.zzf.bashnorm.lexicon.GrammarProfileLoader;
import com.zzf.bashnorm.lexicon.LexicalClassifier;
import com.zzf.bashnorm.normalize.CommandNormalizer;
import com.zzf.bashnorm.normalize.ShellCommandNormalizer;
import com.zzf.bashnorm.preprocess.SyntaxPreprocessor;
import com.zzf.bashnorm.syntax.RecursiveDescentShellParser;
import com.zzf.bashnorm.syntax.ShellParser;
import com.zzf.bashnorm.tree.TreeJsonWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one grammar profile into the normalization pipeline.
 */
@Slf4j
@Configuration
public class NormalizerConfiguration {

    @Bean
    public GrammarProfile grammarProfile(NormalizerProperties properties) {
        GrammarProfile profile = new GrammarProfileLoader().load(properties.getProfileLocation());
        if (properties.getMaxDepth() > 0) {
            log.debug("Overriding profile max depth {} with {}", profile.getMaxDepth(), properties.getMaxDepth());
            profile.setMaxDepth(properties.getMaxDepth());
        }
        return profile;
    }

    @Bean
    public LexicalClassifier lexicalClassifier(GrammarProfile profile) {
        return new LexicalClassifier(profile);
    }

    @Bean
    public ArgumentTypeClassifier argumentTypeClassifier(GrammarProfile profile) {
        return new ArgumentTypeClassifier(profile);
    }

    @Bean
    public SyntaxPreprocessor syntaxPreprocessor(GrammarProfile profile) {
        return new SyntaxPreprocessor(profile);
    }

    @Bean
    public ShellParser shellParser(LexicalClassifier lexicalClassifier) {
        return new RecursiveDescentShellParser(lexicalClassifier.maxDepth());
    }

    @Bean
    public CommandNormalizer commandNormalizer(LexicalClassifier lexicalClassifier, ArgumentTypeClassifier argumentTypeClassifier) {
        return new CommandNormalizer(lexicalClassifier, argumentTypeClassifier);
    }

    @Bean
    public ShellCommandNormalizer shellCommandNormalizer(SyntaxPreprocessor syntaxPreprocessor,
                                                         ShellParser shellParser,
                                                         CommandNormalizer commandNormalizer) {
        return new ShellCommandNormalizer(syntaxPreprocessor, shellParser, commandNormalizer);
    }

    @Bean
    public TreeJsonWriter treeJsonWriter() {
        return new TreeJsonWriter();
    }
}
