package com.openforge.mcpgateway.conversation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A single tool invocation requested by the model.
 *
 * {@code arguments} is the already-parsed JSON object; providers that send
 * arguments as an encoded string are decoded by their adapter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCall(
        @JsonProperty("name")      String     name,
        @JsonProperty("id")        String     id,
        @JsonProperty("arguments") ObjectNode arguments
) {}
