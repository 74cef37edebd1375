package com.openforge.mcpgateway.config;

import com.openforge.mcpgateway.config.GatewayProperties.AuthConfig;
import com.openforge.mcpgateway.workspace.GatewayTopology;
import com.openforge.mcpgateway.workspace.Workspace;
import com.openforge.mcpgateway.workspace.WorkspaceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.stream.Collectors;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Sections:
 *   - Server: default listener, Java version, loop limits
 *   - Models: type, endpoint and auth mode (secrets masked)
 *   - MCP servers: transport and endpoint
 *   - Workspaces: listener, path, model and tool providers
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final GatewayProperties properties;
    private final GatewayTopology   topology;
    private final WorkspaceRegistry registry;
    private final Environment       env;

    @Override
    public void run(ApplicationArguments args) {
        String address     = env.getProperty("server.address", "0.0.0.0");
        String javaVersion = System.getProperty("java.version");

        String models = properties.models().entrySet().stream()
                .map(e -> "║    %-14s : %s  %s  auth=%s".formatted(e.getKey(), e.getValue().type(),
                        e.getValue().url(), describeAuth(e.getValue().auth())))
                .collect(Collectors.joining("\n"));

        String mcps = properties.mcps().entrySet().stream()
                .map(e -> "║    %-14s : %s".formatted(e.getKey(), e.getValue().command() != null
                        ? "stdio  " + e.getValue().command()
                        : (e.getValue().sse() ? "sse  " : "http  ") + e.getValue().url()))
                .collect(Collectors.joining("\n"));

        String workspaces = registry.all().stream()
                .sorted(Comparator.comparing(Workspace::name))
                .map(w -> "║    %-14s : %s:%d%s  model=%s  mcps=%d".formatted(w.name(),
                        w.port() == null ? address : w.address(),
                        w.port() == null ? registry.defaultPort() : w.port(),
                        w.path(), w.model().name(), w.tools().size()))
                .collect(Collectors.joining("\n"));

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            MCP Gateway  —  Startup Summary               ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    Listener       : {}:{}
                ║    Java Version   : {}
                ║    Max Iterations : {}
                ║    Request Timeout: {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Models ({})
                {}
                ╠══════════════════════════════════════════════════════════╣
                ║  MCP Servers ({})
                {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Workspaces ({})
                {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                address, registry.defaultPort(),
                javaVersion,
                properties.maxIterations(),
                properties.requestTimeout(),

                topology.models().size(), models.isEmpty() ? "║    (none)" : models,
                topology.providers().size(), mcps.isEmpty() ? "║    (none)" : mcps,
                registry.all().size(), workspaces.isEmpty() ? "║    (none)" : workspaces
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String describeAuth(AuthConfig auth) {
        if (auth == null || auth.type() == null) {
            return "none";
        }
        if ("oauth2".equalsIgnoreCase(auth.type())) {
            return "oauth2 client=" + auth.clientId() + " secret=" + maskKey(auth.clientSecret());
        }
        return "apikey " + (auth.location() == null ? "header" : auth.location())
                + " " + auth.name() + "=" + maskKey(auth.value());
    }

    /**
     * Masks a secret: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("<")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
