package com.openforge.plantmate.tool.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.plantmate.tool.AbstractSkillHandler;
import com.openforge.plantmate.tool.ToolCatalogProperties;
import com.openforge.plantmate.tool.ToolName;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Internet search through the Serper API. Offered only when an API key is configured.
 */
@Component
public class WebSearchSkill extends AbstractSkillHandler {

    private static final int MAX_RESULTS = 8;

    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "query": {
                  "type": "string",
                  "description": "Search query"
                }
              },
              "required": ["query"]
            }
            """;

    private final String apiKey;

    public WebSearchSkill(ObjectMapper objectMapper, ToolCatalogProperties properties) {
        super(objectMapper, SCHEMA);
        this.apiKey = properties.webSearchApiKey();
    }

    @Override
    public ToolName toolName() {
        return ToolName.WEB_SEARCH;
    }

    @Override
    public String description() {
        return "Search the internet for current information: news, exchange rates, manufacturer documentation, "
                + "published standards and similar.";
    }

    @Override
    public JsonNode requestBody(JsonNode arguments) {
        return newBody()
                .put("q", text(arguments, "query", ""))
                .put("num", MAX_RESULTS);
    }

    @Override
    public Map<String, String> headers() {
        return Map.of("X-API-KEY", apiKey);
    }

    @Override
    public String summarize(JsonNode response) {
        int count = Math.min(response.path("organic").size(), MAX_RESULTS);
        return "Found %d web results".formatted(count);
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }
}
