package com.openforge.mcpgateway.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mcpgateway.conversation.ToolSpec;
import com.openforge.mcpgateway.error.ConfigurationException;
import com.openforge.mcpgateway.error.ProtocolException;
import com.openforge.mcpgateway.error.ToolExecutionException;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link ToolProvider} backed by an MCP server through the MCP Java SDK.
 *
 * Three transports:
 *   local    the server is spawned as a child process and spoken to over stdio
 *   remote   Streamable HTTP, or SSE when the server only offers that
 *
 * The client is connected and initialized when the provider is created, so
 * an unreachable server fails startup instead of the first request.
 */
@Slf4j
public class McpToolProvider implements ToolProvider, AutoCloseable {

    static final String CLIENT_NAME    = "mcp-gateway";
    static final String CLIENT_VERSION = "0.1.0";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

    private final String        name;
    private final McpSyncClient client;
    private final ToolFilter    filter;
    private final ObjectMapper  objectMapper;

    McpToolProvider(String name, McpSyncClient client, ToolFilter filter, ObjectMapper objectMapper) {
        this.name         = name;
        this.client       = client;
        this.filter       = filter == null ? ToolFilter.allowAll() : filter;
        this.objectMapper = objectMapper;
    }

    // ── Factories ────────────────────────────────────────────────────────────

    public static McpToolProvider local(String name, String command, List<String> args, Map<String, String> env,
                                        ToolFilter filter, Duration timeout, ObjectMapper objectMapper) {
        ServerParameters.Builder parameters = ServerParameters.builder(command);
        if (args != null) parameters.args(args);
        if (env != null)  parameters.env(env);

        log.info("[MCP:{}] Spawning local server: {} {}", name, command, args == null ? List.of() : args);
        return connect(name, new StdioClientTransport(parameters.build()), filter, timeout, objectMapper);
    }

    public static McpToolProvider remote(String name, String url, boolean sse,
                                         ToolFilter filter, Duration timeout, ObjectMapper objectMapper) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("MCP server \"%s\": invalid URL \"%s\"".formatted(name, url), e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new ConfigurationException("MCP server \"%s\": invalid URL \"%s\"".formatted(name, url));
        }
        String base     = uri.getScheme() + "://" + uri.getRawAuthority();
        String endpoint = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            endpoint += "?" + uri.getRawQuery();
        }

        McpClientTransport transport = sse
                ? HttpClientSseClientTransport.builder(base).sseEndpoint(endpoint).build()
                : HttpClientStreamableHttpTransport.builder(base).endpoint(endpoint).build();

        log.info("[MCP:{}] Connecting to remote server {} ({})", name, url, sse ? "SSE" : "Streamable HTTP");
        return connect(name, transport, filter, timeout, objectMapper);
    }

    private static McpToolProvider connect(String name, McpClientTransport transport, ToolFilter filter,
                                           Duration timeout, ObjectMapper objectMapper) {
        McpSyncClient client = McpClient.sync(transport)
                .requestTimeout(timeout)
                .initializationTimeout(timeout)
                .clientInfo(new McpSchema.Implementation(CLIENT_NAME, CLIENT_VERSION))
                .build();
        try {
            McpSchema.InitializeResult init = client.initialize();
            log.info("[MCP:{}] Connected to {} {}", name,
                    init.serverInfo() == null ? "?" : init.serverInfo().name(),
                    init.serverInfo() == null ? "" : init.serverInfo().version());
        } catch (RuntimeException e) {
            client.close();
            throw new ConfigurationException("Couldn't start MCP server \"%s\"".formatted(name), e);
        }
        return new McpToolProvider(name, client, filter, objectMapper);
    }

    // ── ToolProvider ─────────────────────────────────────────────────────────

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<ToolSpec> listTools() {
        List<ToolSpec> tools  = new ArrayList<>();
        String         cursor = null;
        try {
            do {
                McpSchema.ListToolsResult page = client.listTools(cursor);
                for (McpSchema.Tool tool : page.tools()) {
                    if (filter.allows(tool.name())) {
                        tools.add(new ToolSpec(tool.name(), tool.description(), toSchema(tool)));
                    }
                }
                cursor = page.nextCursor();
            } while (cursor != null);
        } catch (RuntimeException e) {
            log.error("[MCP:{}] Couldn't list tools: {}", name, e.getMessage());
            throw new ToolExecutionException("Couldn't list tools of \"%s\"".formatted(name), e);
        }
        log.debug("[MCP:{}] {} tool(s) after filtering", name, tools.size());
        return tools;
    }

    @Override
    public String callTool(String toolName, ObjectNode arguments) {
        Map<String, Object> args = arguments == null
                ? Map.of()
                : objectMapper.convertValue(arguments, ARGUMENTS_TYPE);

        McpSchema.CallToolResult result;
        try {
            result = client.callTool(new McpSchema.CallToolRequest(toolName, args));
        } catch (RuntimeException e) {
            log.error("[MCP:{}] Call to \"{}\" failed: {}", name, toolName, e.getMessage());
            throw new ToolExecutionException("Tool \"%s\" failed".formatted(toolName), e);
        }

        if (Boolean.TRUE.equals(result.isError())) {
            log.error("[MCP:{}] Tool \"{}\" reported an error: {}", name, toolName, result.content());
        } else {
            log.info("[MCP:{}] Tool \"{}\" returned {} content item(s)", name, toolName,
                    result.content() == null ? 0 : result.content().size());
        }

        if (result.content() == null || result.content().size() != 1) {
            log.error("[MCP:{}] Unsupported tool result for \"{}\": {}", name, toolName, result.content());
            throw new ProtocolException("Tool result must be a single content item");
        }
        if (!(result.content().get(0) instanceof McpSchema.TextContent text)) {
            log.error("[MCP:{}] Non-text tool result for \"{}\": {}", name, toolName, result.content().get(0));
            throw new ProtocolException("Tool result must be text");
        }
        return text.text();
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", name);
        client.close();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ObjectNode toSchema(McpSchema.Tool tool) {
        if (tool.inputSchema() == null) {
            return objectMapper.createObjectNode().put("type", "object");
        }
        JsonNode schema = objectMapper.valueToTree(tool.inputSchema());
        if (!schema.isObject()) {
            throw new ProtocolException("Tool \"%s\" has a non-object input schema".formatted(tool.name()));
        }
        return (ObjectNode) schema;
    }
}
