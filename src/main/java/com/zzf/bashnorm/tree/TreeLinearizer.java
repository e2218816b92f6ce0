package com.zzf.bashnorm.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a normalized tree back into command tokens in source order. Binary operators are written infix,
 * unary operators prefix, and substitutions are wrapped in {@code $(..)}, {@code <(..)} or {@code >(..)}.
 *
 * <p>The template form replaces every argument by the name of its type, so commands that differ only in
 * their argument values share one template.
 */
public final class TreeLinearizer {

    private TreeLinearizer() {}

    public static List<String> toTokens(NormalizedNode node) {
        List<String> tokens = new ArrayList<>();
        append(tokens, node, false);
        return tokens;
    }

    public static String toCommand(NormalizedNode node) {
        return String.join(" ", toTokens(node));
    }

    public static String toTemplate(NormalizedNode node) {
        List<String> tokens = new ArrayList<>();
        append(tokens, node, true);
        return String.join(" ", tokens);
    }

    private static void append(List<String> tokens, NormalizedNode node, boolean template) {
        if (node instanceof PipelineNode pipeline) {
            List<HeadCommandNode> stages = pipeline.stages();
            for (int i = 0; i < stages.size(); i++) {
                if (i > 0) {
                    tokens.add("|");
                }
                append(tokens, stages.get(i), template);
            }
        } else if (node instanceof ArgumentNode argument) {
            tokens.add(template ? argument.type().templateName() : argument.value());
        } else if (node instanceof BinaryLogicOpNode binary) {
            append(tokens, binary.left(), template);
            tokens.add(binary.operator());
            append(tokens, binary.right(), template);
        } else if (node instanceof CommandSubstitutionNode substitution) {
            tokens.add("$(");
            append(tokens, substitution.command(), template);
            tokens.add(")");
        } else if (node instanceof ProcessSubstitutionNode substitution) {
            tokens.add(substitution.direction() + "(");
            append(tokens, substitution.command(), template);
            tokens.add(")");
        } else {
            if (!(node instanceof RootNode)) {
                tokens.add(node.value());
            }
            for (NormalizedNode child : node.children()) {
                append(tokens, child, template);
            }
        }
    }
}
