package com.openforge.plantmate.tool.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.plantmate.tool.AbstractSkillHandler;
import com.openforge.plantmate.tool.ToolName;
import org.springframework.stereotype.Component;

/**
 * Hybrid (BM25 + dense) search over the plant's technical documentation.
 */
@Component
public class DocsSearchSkill extends AbstractSkillHandler {

    public DocsSearchSkill(ObjectMapper objectMapper) {
        super(objectMapper, question("Question to search the documentation for"));
    }

    @Override
    public ToolName toolName() {
        return ToolName.DOCS_SEARCH;
    }

    @Override
    public String description() {
        return "Search the plant's technical documentation (hybrid BM25 + semantic search). Use for "
                + "standards, equipment passports, operating instructions, correspondence and regulations.";
    }

    @Override
    public JsonNode requestBody(JsonNode arguments) {
        return newBody().put("question", text(arguments, "question", ""));
    }

    @Override
    public String summarize(JsonNode response) {
        int count = response.has("chunks_found")
                ? response.path("chunks_found").asInt(0)
                : response.path("sources").size();
        return "Found %d documentation fragments".formatted(count);
    }
}
