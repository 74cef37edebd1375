package com.openforge.mcpgateway.conversation;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A tool as advertised to the model: name, optional description and the
 * JSON schema of its arguments.
 */
public record ToolSpec(
        String     name,
        String     description,
        ObjectNode inputSchema
) {}
