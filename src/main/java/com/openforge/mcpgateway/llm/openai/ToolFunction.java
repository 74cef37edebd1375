package com.openforge.mcpgateway.llm.openai;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The "function" sub-object inside a Tool definition.  parameters is the
 * tool's JSON schema, passed through verbatim.
 */
public record ToolFunction(
        String   name,
        String   description,
        JsonNode parameters
) {}
