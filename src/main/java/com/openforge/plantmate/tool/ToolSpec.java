package com.openforge.plantmate.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.plantmate.gpu.ModelClass;

import java.net.URI;
import java.time.Duration;

/**
 * Immutable description of one registered tool, fixed for the process lifetime.
 *
 * @param tool               closed identifier
 * @param endpoint           where the dispatcher POSTs the request body
 * @param requiredModelClass model that must be resident while the call runs
 * @param timeout            end-to-end wall-clock budget, residency wait included
 * @param description        text shown to the model
 * @param inputSchema        JSON Schema of the arguments the model must supply
 */
public record ToolSpec(
        ToolName   tool,
        URI        endpoint,
        ModelClass requiredModelClass,
        Duration   timeout,
        String     description,
        JsonNode   inputSchema
) {

    public String name() {
        return tool.wireName();
    }
}
