package com.openforge.plantmate.tool.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.plantmate.tool.AbstractSkillHandler;
import com.openforge.plantmate.tool.ToolName;
import org.springframework.stereotype.Component;

/**
 * Drawing analysis on the vision model. Needs the VLM resident, which evicts the LLM.
 */
@Component
public class BlueprintVisionSkill extends AbstractSkillHandler {

    public static final String DEFAULT_QUESTION = "Perform a full analysis of the drawing";

    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "image_path": {
                  "type": "string",
                  "description": "Path to the drawing file, e.g. /app/documents/blueprints/detail.png"
                },
                "question": {
                  "type": "string",
                  "description": "What to determine on the drawing"
                }
              },
              "required": ["image_path"]
            }
            """;

    public BlueprintVisionSkill(ObjectMapper objectMapper) {
        super(objectMapper, SCHEMA);
    }

    @Override
    public ToolName toolName() {
        return ToolName.BLUEPRINT_VISION;
    }

    @Override
    public String description() {
        return "Analyse an engineering drawing with the vision model. Use when the user refers to an uploaded "
                + "drawing and wants its number, dimensions, tolerances, roughness, material or designations.";
    }

    @Override
    public JsonNode requestBody(JsonNode arguments) {
        return newBody()
                .put("image_path", text(arguments, "image_path", ""))
                .put("question", text(arguments, "question", DEFAULT_QUESTION));
    }

    @Override
    public String summarize(JsonNode response) {
        String source = response.path("source").asText("");
        return "graph_cache".equals(source)
                ? "Drawing data taken from the production graph"
                : "Drawing analysed";
    }
}
