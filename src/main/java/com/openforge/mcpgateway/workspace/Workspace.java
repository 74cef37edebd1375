package com.openforge.mcpgateway.workspace;

import com.openforge.mcpgateway.llm.ModelAdapter;
import com.openforge.mcpgateway.mcp.ToolProvider;

import java.util.List;

/**
 * A named routing unit: one path on one listener, bound to one model and
 * an ordered list of tool providers.  Model and providers are shared with
 * every other workspace that references them.
 *
 * @param port    own listener port, or null for the default listener
 * @param address bind address of the own listener
 */
public record Workspace(
        String             name,
        String             path,
        ModelAdapter       model,
        List<ToolProvider> tools,
        Integer            port,
        String             address
) {

    public Workspace {
        tools = List.copyOf(tools);
    }
}
