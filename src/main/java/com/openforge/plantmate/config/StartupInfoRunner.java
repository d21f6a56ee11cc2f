package com.openforge.plantmate.config;

import com.openforge.plantmate.agent.OrchestratorProperties;
import com.openforge.plantmate.gpu.GpuResidencyScheduler;
import com.openforge.plantmate.gpu.ModelRoleProperties;
import com.openforge.plantmate.llm.LlmProperties;
import com.openforge.plantmate.tool.ToolRegistry;
import com.openforge.plantmate.tool.ToolSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.stream.Collectors;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - MySQL: opens a real JDBC connection and reads the server version
 *   - LLM providers: primary + fallback (API keys masked)
 *   - Model slots and role assignments
 *   - Registered tools with endpoint, model class and timeout
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource             dataSource;
    private final LlmProperties          llmProperties;
    private final ModelRoleProperties    models;
    private final OrchestratorProperties orchestrator;
    private final GpuResidencyScheduler  scheduler;
    private final ToolRegistry           toolRegistry;
    private final Environment            env;

    @Override
    public void run(ApplicationArguments args) {
        String slots = scheduler.slots().stream()
                .map(s -> "%s %s %s".formatted(s.id(), s.hostedClasses(), s.baseUrl()))
                .collect(Collectors.joining("\n║                     "));
        String tools = toolRegistry.specs().stream()
                .map(StartupInfoRunner::describe)
                .collect(Collectors.joining("\n║                     "));

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Plantmate : Startup Summary                 ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ║    Max iterations : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database (MySQL)                                        ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Model slots                                             ║
                ║    Slots          : {}
                ║    Roles          : llm={} vlm={} embedding={} reranker={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tools                                                   ║
                ║    Registered     : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),
                orchestrator.maxIterations(),

                probeDatabase(),

                llmProperties.primary().name(),
                llmProperties.primary().model(),
                maskKey(llmProperties.primary().apiKey()),
                llmProperties.hasFallback()
                        ? "%s  [%s]  key=%s".formatted(llmProperties.fallback().name(),
                                llmProperties.fallback().model(), maskKey(llmProperties.fallback().apiKey()))
                        : "(none)",

                slots,
                models.llm(), models.vlm(), models.embedding(), models.reranker(),

                tools
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String describe(ToolSpec spec) {
        return "%s → %s  model=%s  timeout=%ds".formatted(
                spec.name(), spec.endpoint(), spec.requiredModelClass(), spec.timeout().toSeconds());
    }

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /** Shows the first 6 and last 4 characters of a key. */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
