package com.openforge.mcpgateway.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Externalised gateway configuration.
 *
 * Reads from application.yml under the "gateway" prefix:
 *
 * gateway:
 *   request-timeout: 300s
 *   max-iterations: 25
 *   models:
 *     gemini:
 *       type: gemini
 *       url: https://generativelanguage.googleapis.com/v1beta/models/gemini-2.0-flash:generateContent
 *       auth:
 *         type: apikey
 *         location: parameter
 *         name: key
 *         value: ...
 *   mcps:
 *     filesystem:
 *       command: npx
 *       args: [-y, "@modelcontextprotocol/server-filesystem", /tmp]
 *   workspaces:
 *     gemini:
 *       model: gemini
 *       mcps: [filesystem]
 *       path: /gemini
 *       port: 7001
 *
 * Cross references (workspace → model, workspace → MCP) are checked when the
 * topology is built, not here.
 */
@Validated
@ConfigurationProperties(prefix = "gateway")
public record GatewayProperties(
        @DefaultValue("300s") Duration requestTimeout,
        @DefaultValue("25") @Positive int maxIterations,
        @DefaultValue("120s") Duration httpTimeout,
        @DefaultValue("64") @Positive int workerThreads,
        Map<String, ModelConfig>     models,
        Map<String, McpConfig>       mcps,
        Map<String, WorkspaceConfig> workspaces
) {

    public GatewayProperties {
        models     = models == null ? Map.of() : models;
        mcps       = mcps == null ? Map.of() : mcps;
        workspaces = workspaces == null ? Map.of() : workspaces;
    }

    /**
     * @param type one of openai, azure, anthropic, gemini
     */
    public record ModelConfig(
            String     type,
            String     url,
            String     model,
            String     apiVersion,
            String     anthropicVersion,
            AuthConfig auth
    ) {}

    /**
     * @param type     apikey or oauth2
     * @param location apikey only: header or parameter
     * @param prefix   apikey header only, joined to the value with a space (e.g. "Bearer")
     * @param url      oauth2 token endpoint
     */
    public record AuthConfig(
            String type,
            String location,
            String name,
            String value,
            String prefix,
            String url,
            String clientId,
            String clientSecret,
            String scope
    ) {}

    /** Either {@code command} (local, stdio) or {@code url} (remote). */
    public record McpConfig(
            String              command,
            List<String>        args,
            Map<String, String> env,
            String              url,
            @DefaultValue("false") boolean sse,
            FilterConfig        filter,
            AuthConfig          auth
    ) {}

    /** At most one of the two may be set. */
    public record FilterConfig(
            Set<String> include,
            Set<String> exclude
    ) {}

    /**
     * @param port    own listener port; unset means the default server port
     * @param address bind address of the own listener
     */
    public record WorkspaceConfig(
            String       model,
            List<String> mcps,
            String       path,
            Integer      port,
            @DefaultValue("127.0.0.1") String address
    ) {}
}
