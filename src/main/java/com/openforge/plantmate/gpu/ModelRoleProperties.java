package com.openforge.plantmate.gpu;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Which model id backs each role, bound from "plantmate.models".
 * Changing an id here changes what a swap loads; nothing else refers to model names.
 */
@ConfigurationProperties(prefix = "plantmate.models")
public record ModelRoleProperties(
        @DefaultValue("qwen3:30b") String llm,
        @DefaultValue("qwen3-vl:14b") String vlm,
        @DefaultValue("qwen3-embedding") String embedding,
        @DefaultValue("qwen3-reranker") String reranker
) {

    public String modelFor(ModelClass modelClass) {
        return switch (modelClass) {
            case LLM       -> llm;
            case VLM       -> vlm;
            case EMBEDDING -> embedding;
            case RERANKER  -> reranker;
            case NONE      -> throw new IllegalArgumentException("NONE has no model");
        };
    }
}
