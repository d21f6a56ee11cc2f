package com.openforge.plantmate.tool.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.plantmate.tool.AbstractSkillHandler;
import com.openforge.plantmate.tool.ToolName;
import org.springframework.stereotype.Component;

/**
 * Standards compliance check of a drawing or a technological process.
 */
@Component
public class NormControlSkill extends AbstractSkillHandler {

    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "document_type": {
                  "type": "string",
                  "enum": ["drawing", "tech_process"],
                  "description": "drawing or tech_process"
                },
                "identifier": {
                  "type": "string",
                  "description": "Drawing number or process number, e.g. TP-001"
                },
                "image_path": {
                  "type": "string",
                  "description": "Path to the drawing file (optional, drawings only)"
                }
              },
              "required": ["document_type"]
            }
            """;

    public NormControlSkill(ObjectMapper objectMapper) {
        super(objectMapper, SCHEMA);
    }

    @Override
    public ToolName toolName() {
        return ToolName.NORM_CONTROL;
    }

    @Override
    public String description() {
        return "Check a drawing or a technological process against norms and standards. Use when the user asks "
                + "for a norm control or a formatting/compliance review of a document.";
    }

    @Override
    public JsonNode requestBody(JsonNode arguments) {
        ObjectNode body = newBody()
                .put("document_type", text(arguments, "document_type", "drawing"))
                .put("identifier", text(arguments, "identifier", ""));
        String imagePath = text(arguments, "image_path", null);
        if (imagePath == null) {
            body.putNull("image_path");
        } else {
            body.put("image_path", imagePath);
        }
        return body;
    }

    @Override
    public String summarize(JsonNode response) {
        int checks = response.path("checks").size();
        return response.path("passed").asBoolean(false)
                ? "Norm control passed (%d checks)".formatted(checks)
                : "Norm control failed (%d checks)".formatted(checks);
    }
}
