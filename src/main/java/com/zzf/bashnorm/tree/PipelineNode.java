package com.zzf.bashnorm.tree;

import java.util.List;

/**
 * Stages of a pipeline in left-to-right order. Pipe tokens are not materialized.
 */
public record PipelineNode(List<HeadCommandNode> stages) implements NormalizedNode {

    public PipelineNode {
        stages = List.copyOf(stages);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PIPELINE;
    }

    @Override
    public String value() {
        return "";
    }

    @Override
    public List<NormalizedNode> children() {
        return List.copyOf(stages);
    }
}
