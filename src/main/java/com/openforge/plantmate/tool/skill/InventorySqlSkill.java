package com.openforge.plantmate.tool.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.plantmate.tool.AbstractSkillHandler;
import com.openforge.plantmate.tool.ToolName;
import org.springframework.stereotype.Component;

/**
 * Warehouse database (text-to-SQL): stock of tools, metals and polymers, item catalogues.
 */
@Component
public class InventorySqlSkill extends AbstractSkillHandler {

    public InventorySqlSkill(ObjectMapper objectMapper) {
        super(objectMapper, question("Question about warehouse stock or the item catalogue"));
    }

    @Override
    public ToolName toolName() {
        return ToolName.INVENTORY_SQL;
    }

    @Override
    public String description() {
        return "Query the warehouse database. Use for stock levels of cutting tools, metals and polymers, "
                + "item catalogues, and material or tool characteristics.";
    }

    @Override
    public JsonNode requestBody(JsonNode arguments) {
        return newBody().put("question", text(arguments, "question", ""));
    }

    @Override
    public String summarize(JsonNode response) {
        int rows = response.path("rows_count").asInt(0);
        String answer = firstSentence(response.path("answer").asText(""));
        String summary = answer.isEmpty()
                ? "Retrieved %d row(s) from the warehouse".formatted(rows)
                : "Retrieved %d row(s) from the warehouse: %s".formatted(rows, answer);
        return truncate(summary, MAX_SUMMARY_LENGTH);
    }
}
