package com.openforge.mcpgateway.workspace;

import com.openforge.mcpgateway.config.GatewayProperties;
import com.openforge.mcpgateway.config.GatewayProperties.WorkspaceConfig;
import com.openforge.mcpgateway.error.ConfigurationException;
import com.openforge.mcpgateway.llm.ModelAdapter;
import com.openforge.mcpgateway.mcp.McpToolProvider;
import com.openforge.mcpgateway.mcp.ToolProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything "gateway.*" describes, built once at startup:
 *
 *   models        one adapter per entry, shared by all workspaces naming it
 *   mcps          one connected client per entry, likewise shared
 *   workspaces    registered in the {@link WorkspaceRegistry}
 *
 * Any inconsistency (undefined reference, bad path, bad URL) throws a
 * ConfigurationException and aborts startup.  MCP clients are closed on
 * shutdown.
 */
@Slf4j
@Component
public class GatewayTopology implements DisposableBean {

    private final Map<String, ModelAdapter>    models    = new LinkedHashMap<>();
    private final Map<String, McpToolProvider> providers = new LinkedHashMap<>();

    public GatewayTopology(GatewayProperties properties,
                           ModelAdapterFactory modelFactory,
                           ToolProviderFactory toolFactory,
                           WorkspaceRegistry registry) {
        try {
            properties.models().forEach((name, config) -> {
                log.debug("[Config] Parsing model \"{}\"", name);
                models.put(name, modelFactory.create(name, config));
            });
            properties.mcps().forEach((name, config) -> {
                log.debug("[Config] Parsing MCP server \"{}\"", name);
                providers.put(name, toolFactory.create(name, config));
            });
            properties.workspaces().forEach((name, config) -> {
                log.debug("[Config] Parsing workspace \"{}\"", name);
                registry.register(toWorkspace(name, config));
            });
        } catch (RuntimeException e) {
            destroy();
            throw e;
        }
    }

    private Workspace toWorkspace(String name, WorkspaceConfig config) {
        ModelAdapter model = models.get(config.model());
        if (model == null) {
            throw new ConfigurationException("Undefined model \"%s\"".formatted(config.model()));
        }
        List<ToolProvider> tools = new ArrayList<>();
        if (config.mcps() != null) {
            for (String mcp : config.mcps()) {
                ToolProvider provider = providers.get(mcp);
                if (provider == null) {
                    throw new ConfigurationException("Undefined MCP server \"%s\"".formatted(mcp));
                }
                tools.add(provider);
            }
        }
        return new Workspace(name, config.path(), model, tools, config.port(), config.address());
    }

    public Map<String, ModelAdapter> models() {
        return Collections.unmodifiableMap(models);
    }

    public Map<String, McpToolProvider> providers() {
        return Collections.unmodifiableMap(providers);
    }

    @Override
    public void destroy() {
        providers.forEach((name, provider) -> {
            try {
                provider.close();
            } catch (RuntimeException e) {
                log.warn("[Config] Couldn't close MCP server \"{}\": {}", name, e.getMessage());
            }
        });
    }
}
