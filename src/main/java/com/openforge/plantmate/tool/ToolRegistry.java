package com.openforge.plantmate.tool;

import com.openforge.plantmate.llm.model.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static table of invocable tools, built once at startup.
 *
 * Every {@link SkillHandler} bean contributes one {@link ToolSpec}; catalog
 * entries may override its endpoint or timeout. Configuration mistakes
 * (a tool registered twice, an entry for a tool that does not exist or has
 * no handler) abort startup instead of surfacing mid-conversation.
 *
 * Immutable after construction, so lookups need no locking.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<ToolName, ToolSpec>     specs;
    private final Map<ToolName, SkillHandler> handlers;

    public ToolRegistry(List<SkillHandler> skillHandlers, ToolCatalogProperties properties) {
        Map<ToolName, SkillHandler> byName = new EnumMap<>(ToolName.class);
        for (SkillHandler handler : skillHandlers) {
            SkillHandler previous = byName.put(handler.toolName(), handler);
            if (previous != null) {
                throw new IllegalStateException("Tool '%s' registered twice: %s and %s".formatted(
                        handler.toolName().wireName(),
                        previous.getClass().getSimpleName(),
                        handler.getClass().getSimpleName()));
            }
        }

        Map<ToolName, ToolCatalogProperties.Entry> overrides = indexEntries(properties.entries(), byName);

        Map<ToolName, ToolSpec> built = new EnumMap<>(ToolName.class);
        for (Map.Entry<ToolName, SkillHandler> e : byName.entrySet()) {
            ToolName     name    = e.getKey();
            SkillHandler handler = e.getValue();
            if (!handler.isAvailable()) {
                log.info("[Tools] '{}' not available in this deployment, skipped.", name.wireName());
                continue;
            }
            built.put(name, buildSpec(name, handler, overrides.get(name), properties));
        }

        this.specs    = Collections.unmodifiableMap(built);
        this.handlers = Collections.unmodifiableMap(byName);
        log.info("[Tools] Registry ready with {} tool(s): {}", specs.size(),
                specs.values().stream().map(ToolSpec::name).toList());
    }

    // ── Lookups ──────────────────────────────────────────────────────────────

    public Optional<ToolSpec> lookup(String name) {
        return ToolName.fromWireName(name).map(specs::get);
    }

    public ToolSpec require(String name) {
        return lookup(name).orElseThrow(() -> new ToolNotFoundException(name));
    }

    public SkillHandler handlerFor(ToolName name) {
        SkillHandler handler = handlers.get(name);
        if (handler == null || !specs.containsKey(name)) {
            throw new ToolNotFoundException(name.wireName());
        }
        return handler;
    }

    public Collection<ToolSpec> specs() {
        return specs.values();
    }

    /** The OpenAI-compatible {@code tools} array offered to the model. */
    public List<ToolDefinition> definitions() {
        return specs.values().stream()
                .map(spec -> ToolDefinition.of(spec.name(), spec.description(), spec.inputSchema()))
                .toList();
    }

    // ── Construction helpers ─────────────────────────────────────────────────

    private static Map<ToolName, ToolCatalogProperties.Entry> indexEntries(
            List<ToolCatalogProperties.Entry> entries, Map<ToolName, SkillHandler> handlers) {

        Map<ToolName, ToolCatalogProperties.Entry> indexed = new EnumMap<>(ToolName.class);
        Set<String> seen = new HashSet<>();
        for (ToolCatalogProperties.Entry entry : entries) {
            ToolName name = ToolName.fromWireName(entry.name())
                    .orElseThrow(() -> new IllegalStateException(
                            "plantmate.tools.entries names an unknown tool: " + entry.name()));
            if (!seen.add(name.wireName())) {
                throw new IllegalStateException(
                        "plantmate.tools.entries lists '%s' more than once".formatted(name.wireName()));
            }
            if (!handlers.containsKey(name)) {
                throw new IllegalStateException(
                        "plantmate.tools.entries configures '%s' but no handler implements it"
                                .formatted(name.wireName()));
            }
            indexed.put(name, entry);
        }
        return indexed;
    }

    private static ToolSpec buildSpec(ToolName name,
                                      SkillHandler handler,
                                      ToolCatalogProperties.Entry override,
                                      ToolCatalogProperties properties) {
        String endpoint = override != null && override.endpoint() != null && !override.endpoint().isBlank()
                ? override.endpoint()
                : name.defaultEndpoint();

        Duration timeout = override != null && override.timeout() != null
                ? override.timeout()
                : name.defaultTimeout().orElse(properties.defaultTimeout());
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalStateException("Timeout for '%s' must be positive".formatted(name.wireName()));
        }

        return new ToolSpec(
                name,
                resolve(properties.baseUrl(), endpoint),
                name.modelClass(),
                timeout,
                handler.description(),
                handler.inputSchema()
        );
    }

    static URI resolve(String baseUrl, String endpoint) {
        if (endpoint.startsWith("http://") || endpoint.startsWith("https://")) {
            return URI.create(endpoint);
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String path = endpoint.startsWith("/") ? endpoint : "/" + endpoint;
        return URI.create(base + path);
    }
}
