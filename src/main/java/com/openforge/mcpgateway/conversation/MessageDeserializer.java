package com.openforge.mcpgateway.conversation;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a {@link Message} by field presence.
 *
 * The shapes can overlap (an assistant turn may carry both "content" and
 * "tool_calls"), so the checks run in a fixed order: textual content first,
 * then a tool_calls array, then call_id + output.
 */
public class MessageDeserializer extends StdDeserializer<Message> {

    public MessageDeserializer() {
        super(Message.class);
    }

    @Override
    public Message deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = parser.readValueAsTree();
        if (node == null || !node.isObject()) {
            throw ctxt.instantiationException(Message.class, "message must be a JSON object");
        }

        JsonNode content = node.get("content");
        if (content != null && content.isTextual()) {
            return new Message.TextMessage(readRole(node, ctxt), content.asText());
        }

        JsonNode toolCalls = node.get("tool_calls");
        if (toolCalls != null && toolCalls.isArray()) {
            List<ToolCall> calls = new ArrayList<>(toolCalls.size());
            for (JsonNode call : toolCalls) {
                calls.add(ctxt.readTreeAsValue(call, ToolCall.class));
            }
            return new Message.ToolCalls(readRole(node, ctxt), calls);
        }

        JsonNode callId = node.get("call_id");
        JsonNode output = node.get("output");
        if (callId != null && callId.isTextual() && output != null && output.isTextual()) {
            return new Message.ToolOutput(callId.asText(), output.asText());
        }

        throw ctxt.instantiationException(Message.class,
                "unrecognized message shape, expected content, tool_calls or call_id/output");
    }

    private static Role readRole(JsonNode node, DeserializationContext ctxt) throws IOException {
        JsonNode role = node.get("role");
        if (role == null || !role.isTextual()) {
            throw ctxt.instantiationException(Message.class, "message is missing a textual \"role\"");
        }
        try {
            return Role.fromWireName(role.asText());
        } catch (IllegalArgumentException e) {
            throw ctxt.weirdStringException(role.asText(), Role.class, "unknown role");
        }
    }
}
