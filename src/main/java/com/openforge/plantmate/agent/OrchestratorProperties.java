package com.openforge.plantmate.agent;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Agent loop tuning, bound from "plantmate.orchestrator".
 *
 * @param maxIterations      tool round-trips allowed per turn before forced finalization
 * @param tokenChunkSize     characters per token event when replaying a finished answer
 * @param maxContextMessages sliding-window size of the history sent to the model
 * @param modelWait          how long a model call may wait for the LLM to become resident
 * @param systemPrompt       instructions prepended to every request; built-in prompt when unset
 */
@Validated
@ConfigurationProperties(prefix = "plantmate.orchestrator")
public record OrchestratorProperties(
        @DefaultValue("5") @Min(1) int maxIterations,
        @DefaultValue("8") @Min(1) int tokenChunkSize,
        @DefaultValue("50") @Min(4) int maxContextMessages,
        @DefaultValue("120s") Duration modelWait,
        String systemPrompt
) {

    public OrchestratorProperties {
        if (systemPrompt == null || systemPrompt.isBlank()) {
            systemPrompt = DEFAULT_SYSTEM_PROMPT;
        }
    }

    public static final String DEFAULT_SYSTEM_PROMPT = """
            You are the engineering assistant of a manufacturing plant. You talk to the plant's \
            engineers and technologists through a secure web interface.

            Rules:
            1. Always use the tools to get current data from the plant's systems. Never invent facts.
            2. When you use data, name its source (which tool it came from).
            3. For complex questions call several tools one after another.
            4. Structure answers with Markdown headings, lists and tables.
            5. If a tool reports an error, tell the user and suggest an alternative.
            6. Use technical terms precisely.

            Tools:
            - enterprise_graph_search: production graph (parts, routes, processes, machines, labour)
            - enterprise_docs_search: technical documentation (standards, passports, instructions)
            - inventory_sql_search: warehouse records (stock, item catalogue)
            - blueprint_vision: drawing analysis (needs the file path)
            - norm_control: standards compliance of a drawing or a technological process
            - web_search: internet search (current information from the web)
            """;
}
