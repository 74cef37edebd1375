package com.openforge.mcpgateway.workspace;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mcpgateway.config.GatewayProperties;
import com.openforge.mcpgateway.config.GatewayProperties.FilterConfig;
import com.openforge.mcpgateway.config.GatewayProperties.McpConfig;
import com.openforge.mcpgateway.error.ConfigurationException;
import com.openforge.mcpgateway.mcp.McpToolProvider;
import com.openforge.mcpgateway.mcp.ToolFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Turns one "gateway.mcps" entry into a connected {@link McpToolProvider}. */
@Component
@RequiredArgsConstructor
public class ToolProviderFactory {

    private final GatewayProperties properties;
    private final ObjectMapper      objectMapper;

    public McpToolProvider create(String name, McpConfig config) {
        ToolFilter filter = toFilter(name, config.filter());

        if (config.command() != null && config.url() != null) {
            throw new ConfigurationException(
                    "MCP server \"%s\": set either command or url, not both".formatted(name));
        }
        if (config.command() != null) {
            return McpToolProvider.local(name, config.command(), config.args(), config.env(),
                    filter, properties.httpTimeout(), objectMapper);
        }
        if (config.url() != null) {
            if (config.auth() != null) {
                throw new ConfigurationException(
                        "MCP server \"%s\": authentication of remote MCP servers isn't supported".formatted(name));
            }
            return McpToolProvider.remote(name, config.url(), config.sse(),
                    filter, properties.httpTimeout(), objectMapper);
        }
        throw new ConfigurationException("MCP server \"%s\": needs a command or a url".formatted(name));
    }

    static ToolFilter toFilter(String name, FilterConfig config) {
        if (config == null) {
            return ToolFilter.allowAll();
        }
        if (config.include() != null && config.exclude() != null) {
            throw new ConfigurationException(
                    "MCP server \"%s\": filter has both include and exclude".formatted(name));
        }
        if (config.include() != null) {
            return new ToolFilter.Include(config.include());
        }
        if (config.exclude() != null) {
            return new ToolFilter.Exclude(config.exclude());
        }
        return ToolFilter.allowAll();
    }
}
