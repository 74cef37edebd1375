package com.openforge.mcpgateway.mcp;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mcpgateway.conversation.ToolSpec;

import java.util.List;

/**
 * A source of tools the model may call, usually one MCP server.
 *
 * One instance is shared by every workspace that references it and is
 * called concurrently from many requests.
 */
public interface ToolProvider {

    /** Configured provider name, for logs. */
    String name();

    /**
     * The tools this provider exposes, already narrowed by its filter.
     *
     * @throws com.openforge.mcpgateway.error.ToolExecutionException if the tool list can't be fetched
     */
    List<ToolSpec> listTools();

    /**
     * Invoke {@code toolName} and return its text result.
     *
     * @param arguments tool arguments, or null for none
     * @throws com.openforge.mcpgateway.error.ToolExecutionException if the call can't be made
     * @throws com.openforge.mcpgateway.error.ProtocolException      if the result isn't a single text item
     */
    String callTool(String toolName, ObjectNode arguments);
}
