package com.openforge.plantmate.gpu;

/**
 * The kind of model a call needs resident in accelerator memory.
 *
 * LLM and VLM share one GPU slot and evict each other; EMBEDDING and RERANKER
 * live together on a separate slot and never swap.
 */
public enum ModelClass {

    /** The call needs no locally hosted model (e.g. an external web API). */
    NONE,

    LLM,

    VLM,

    EMBEDDING,

    RERANKER;

    public boolean requiresResidency() {
        return this != NONE;
    }
}
