package com.openforge.plantmate.tool;

import com.openforge.plantmate.gpu.ModelClass;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of skills the model may call. Anything the model names that
 * is not listed here is rejected at the registry boundary.
 *
 * The default endpoint is either a path on the skill service
 * ({@code plantmate.tools.base-url}) or an absolute URL.
 */
public enum ToolName {

    GRAPH_SEARCH("enterprise_graph_search", "/skills/graph-search", ModelClass.LLM, null),

    DOCS_SEARCH("enterprise_docs_search", "/skills/docs-search", ModelClass.LLM, null),

    INVENTORY_SQL("inventory_sql_search", "/skills/inventory-sql", ModelClass.LLM, null),

    BLUEPRINT_VISION("blueprint_vision", "/skills/blueprint-vision", ModelClass.VLM, null),

    NORM_CONTROL("norm_control", "/skills/norm-control", ModelClass.LLM, null),

    WEB_SEARCH("web_search", "https://google.serper.dev/search", ModelClass.NONE, Duration.ofSeconds(15));

    private final String     wireName;
    private final String     defaultEndpoint;
    private final ModelClass modelClass;
    private final Duration   defaultTimeout;

    ToolName(String wireName, String defaultEndpoint, ModelClass modelClass, Duration defaultTimeout) {
        this.wireName        = wireName;
        this.defaultEndpoint = defaultEndpoint;
        this.modelClass      = modelClass;
        this.defaultTimeout  = defaultTimeout;
    }

    public String wireName() {
        return wireName;
    }

    public String defaultEndpoint() {
        return defaultEndpoint;
    }

    public ModelClass modelClass() {
        return modelClass;
    }

    /** Tool-specific timeout, or empty to use the catalog default. */
    public Optional<Duration> defaultTimeout() {
        return Optional.ofNullable(defaultTimeout);
    }

    public static Optional<ToolName> fromWireName(String name) {
        if (name == null) return Optional.empty();
        String normalized = name.trim();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
