package com.openforge.mcpgateway.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;

/**
 * One entry of the canonical conversation.
 *
 * Three shapes, told apart on the wire purely by which fields are present:
 *
 *   TextMessage  {"role":"user","content":"hi"}
 *   ToolCalls    {"role":"assistant","tool_calls":[{"name":..,"id":..,"arguments":{..}}]}
 *   ToolOutput   {"type":"function_call_output","call_id":"..","output":".."}
 *
 * Decoding lives in {@link MessageDeserializer}.
 */
@JsonDeserialize(using = MessageDeserializer.class)
public sealed interface Message permits Message.TextMessage, Message.ToolCalls, Message.ToolOutput {

    record TextMessage(
            @JsonProperty("role")    Role   role,
            @JsonProperty("content") String content
    ) implements Message {}

    record ToolCalls(
            @JsonProperty("role")       Role           role,
            @JsonProperty("tool_calls") List<ToolCall> calls
    ) implements Message {

        public ToolCalls {
            calls = List.copyOf(calls);
        }
    }

    @JsonPropertyOrder({"type", "call_id", "output"})
    record ToolOutput(
            @JsonProperty("call_id") String callId,
            @JsonProperty("output")  String output
    ) implements Message {

        public static final String TYPE = "function_call_output";

        @JsonProperty("type")
        public String type() {
            return TYPE;
        }
    }

    // ── Static factory helpers ──────────────────────────────────────────────

    static Message system(String content) {
        return new TextMessage(Role.SYSTEM, content);
    }

    static Message user(String content) {
        return new TextMessage(Role.USER, content);
    }

    static Message assistantText(String content) {
        return new TextMessage(Role.ASSISTANT, content);
    }

    static Message assistantToolCalls(List<ToolCall> calls) {
        return new ToolCalls(Role.ASSISTANT, calls);
    }

    static Message toolOutput(String callId, String output) {
        return new ToolOutput(callId, output);
    }
}
