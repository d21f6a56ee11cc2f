package com.openforge.plantmate.tool.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.plantmate.tool.AbstractSkillHandler;
import com.openforge.plantmate.tool.ToolName;
import org.springframework.stereotype.Component;

/**
 * Production knowledge graph: parts, drawings, routings, operations, machines, tooling.
 * The skill translates the question to Cypher on the GPU LLM.
 */
@Component
public class GraphSearchSkill extends AbstractSkillHandler {

    public GraphSearchSkill(ObjectMapper objectMapper) {
        super(objectMapper, question("Question about production data in natural language"));
    }

    @Override
    public ToolName toolName() {
        return ToolName.GRAPH_SEARCH;
    }

    @Override
    public String description() {
        return "Search the production knowledge graph. Use for questions about parts and their drawings, "
                + "manufacturing routes, technological processes and operations, machines and equipment, "
                + "moulds and tooling, and the links between parts and operations.";
    }

    @Override
    public JsonNode requestBody(JsonNode arguments) {
        return newBody().put("question", text(arguments, "question", ""));
    }

    @Override
    public String summarize(JsonNode response) {
        int count = response.path("records_count").asInt(0);
        return "Found %d records in the production graph".formatted(count);
    }
}
