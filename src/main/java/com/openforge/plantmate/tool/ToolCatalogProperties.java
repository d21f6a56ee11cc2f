package com.openforge.plantmate.tool;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Tool catalog configuration, bound from "plantmate.tools":
 *
 * plantmate:
 *   tools:
 *     base-url: http://api:8000
 *     default-timeout: 120s
 *     web-search-api-key: ${WEB_SEARCH_API_KEY:}
 *     entries:
 *       - name: blueprint_vision
 *         timeout: 180s
 *       - name: inventory_sql_search
 *         endpoint: http://warehouse-skill:8000/skills/inventory-sql
 *
 * Entries are optional overrides; every known tool with a handler is registered.
 * Naming the same tool twice, or a tool that does not exist, fails startup.
 */
@ConfigurationProperties(prefix = "plantmate.tools")
public record ToolCatalogProperties(
        @DefaultValue("http://localhost:8000") String baseUrl,
        @DefaultValue("120s") Duration defaultTimeout,
        String webSearchApiKey,
        @DefaultValue List<Entry> entries
) {

    public record Entry(
            String name,
            String endpoint,
            Duration timeout
    ) {}
}
