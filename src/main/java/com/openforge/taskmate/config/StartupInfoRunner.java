package com.openforge.taskmate.config;

import com.openforge.taskmate.llm.LlmProperties;
import com.openforge.taskmate.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Logs a startup summary once the context is ready: database reachability,
 * LLM providers (keys masked), the registered tools and the confirmation
 * policy in force.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource               dataSource;
    private final LlmProperties            llmProperties;
    private final OrchestratorProperties   orchestratorProperties;
    private final DisambiguationProperties disambiguationProperties;
    private final ToolRegistry             toolRegistry;
    private final Environment              env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Taskmate  -  Startup Summary                ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}  [{}]  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Orchestrator                                            ║
                ║    Tools          : {}
                ║    Auto-confirm   : {}  (delete always asks)
                ║    Confirm window : {}
                ║    Context window : {} messages
                ║    Disambiguation : threshold={} margin={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                probeDatabase(),

                nameOf(llmProperties.primary()), modelOf(llmProperties.primary()), keyOf(llmProperties.primary()),
                nameOf(llmProperties.fallback()), modelOf(llmProperties.fallback()), keyOf(llmProperties.fallback()),

                String.join(", ", toolRegistry.names()),
                orchestratorProperties.autoConfirmNonDestructive() ? "✔ update/complete" : "✘ off",
                orchestratorProperties.confirmationWindow(),
                orchestratorProperties.maxContextMessages(),
                disambiguationProperties.threshold(), disambiguationProperties.margin()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String product = conn.getMetaData().getDatabaseProductName();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + product + " " + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            log.warn("[Startup] Database probe failed: {}", e.getMessage());
            return "✘ FAILED: " + e.getMessage();
        }
    }

    private static String nameOf(LlmProperties.ProviderConfig provider) {
        return provider == null ? "(none)" : provider.name();
    }

    private static String modelOf(LlmProperties.ProviderConfig provider) {
        return provider == null ? "-" : provider.model();
    }

    private static String keyOf(LlmProperties.ProviderConfig provider) {
        return provider == null ? "-" : provider.maskedKey();
    }
}
