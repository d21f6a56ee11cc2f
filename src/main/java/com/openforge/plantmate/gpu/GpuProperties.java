package com.openforge.plantmate.gpu;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Accelerator slots and swap policy, bound from "plantmate.gpu":
 *
 * plantmate:
 *   gpu:
 *     swap-timeout: 90s
 *     llm-resident: true
 *     slots:
 *       - id: gpu0
 *         base-url: http://ollama-gpu:11434
 *         model-classes: [LLM, VLM]
 *         num-ctx: 16384
 *       - id: cpu0
 *         base-url: http://ollama-cpu:11434
 *         model-classes: [EMBEDDING, RERANKER]
 *         swapping: false
 *
 * When no slots are configured the two defaults above are used.
 */
@ConfigurationProperties(prefix = "plantmate.gpu")
public record GpuProperties(
        @DefaultValue("90s") Duration swapTimeout,
        @DefaultValue("true") boolean llmResident,
        @DefaultValue List<Slot> slots
) {

    public static final List<Slot> DEFAULT_SLOTS = List.of(
            new Slot("gpu0", "http://ollama-gpu:11434", Set.of(ModelClass.LLM, ModelClass.VLM), 16384, true),
            new Slot("cpu0", "http://ollama-cpu:11434", Set.of(ModelClass.EMBEDDING, ModelClass.RERANKER), 16384, false)
    );

    public List<Slot> effectiveSlots() {
        return slots.isEmpty() ? DEFAULT_SLOTS : slots;
    }

    /**
     * @param swapping false when every hosted class stays loaded side by side
     *                 (ownership is still exclusive, but no unload/load happens)
     */
    public record Slot(
            String id,
            String baseUrl,
            Set<ModelClass> modelClasses,
            @DefaultValue("16384") int numCtx,
            @DefaultValue("true") boolean swapping
    ) {}
}
