package com.openforge.mcpgateway.llm.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mcpgateway.conversation.Conversation;
import com.openforge.mcpgateway.conversation.Message;
import com.openforge.mcpgateway.conversation.ModelDecision;
import com.openforge.mcpgateway.conversation.ModelReply;
import com.openforge.mcpgateway.conversation.ToolCall;
import com.openforge.mcpgateway.conversation.ToolSpec;
import com.openforge.mcpgateway.conversation.UsageTokens;
import com.openforge.mcpgateway.error.ProtocolException;
import com.openforge.mcpgateway.support.TestTransport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiCodecTest {

    private final ObjectMapper objectMapper = TestTransport.objectMapper();
    private final OpenAiCodec  codec        = new OpenAiCodec(objectMapper, "test");

    // ── Request ──────────────────────────────────────────────────────────────

    @Test
    void encodesEveryMessageShape() throws Exception {
        ObjectNode args = objectMapper.createObjectNode().put("city", "Oslo");
        Conversation conversation = new Conversation(List.of(
                Message.system("be brief"),
                Message.user("weather?"),
                Message.assistantToolCalls(List.of(
                        new ToolCall("weather", "call_1", args),
                        new ToolCall("time", "call_2", null))),
                Message.toolOutput("call_1", "sunny"),
                Message.toolOutput("call_2", "noon")),
                0.3, 256, 0.8, null);

        JsonNode json = objectMapper.valueToTree(codec.toRequest(conversation, List.of(), "gpt-4o"));

        assertThat(json.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(json.path("temperature").asDouble()).isEqualTo(0.3);
        assertThat(json.path("max_tokens").asInt()).isEqualTo(256);
        assertThat(json.path("top_p").asDouble()).isEqualTo(0.8);

        JsonNode messages = json.path("messages");
        assertThat(messages).hasSize(5);
        assertThat(messages.get(0).path("role").asText()).isEqualTo("system");
        assertThat(messages.get(0).path("content").asText()).isEqualTo("be brief");

        JsonNode calls = messages.get(2).path("tool_calls");
        assertThat(messages.get(2).path("role").asText()).isEqualTo("assistant");
        assertThat(messages.get(2).has("content")).isFalse();
        assertThat(calls.get(0).path("id").asText()).isEqualTo("call_1");
        assertThat(calls.get(0).path("type").asText()).isEqualTo("function");
        assertThat(calls.get(0).path("function").path("name").asText()).isEqualTo("weather");
        assertThat(objectMapper.readTree(calls.get(0).path("function").path("arguments").asText()))
                .isEqualTo(args);
        assertThat(calls.get(1).path("function").path("arguments").asText()).isEqualTo("{}");

        assertThat(messages.get(3).path("role").asText()).isEqualTo("tool");
        assertThat(messages.get(3).path("tool_call_id").asText()).isEqualTo("call_1");
        assertThat(messages.get(3).path("content").asText()).isEqualTo("sunny");
    }

    @Test
    void omitsToolsAndToolChoiceWithoutTools() {
        JsonNode json = objectMapper.valueToTree(
                codec.toRequest(Conversation.of(List.of(Message.user("hi"))), List.of(), "m"));

        assertThat(json.has("tools")).isFalse();
        assertThat(json.has("tool_choice")).isFalse();
        assertThat(json.has("temperature")).isFalse();
    }

    @Test
    void advertisesToolsWithAutoChoiceAndEmptyMissingDescription() {
        ObjectNode schema = objectMapper.createObjectNode().put("type", "object");
        JsonNode json = objectMapper.valueToTree(codec.toRequest(
                Conversation.of(List.of(Message.user("hi"))),
                List.of(new ToolSpec("read", "Read a file", schema), new ToolSpec("list", null, schema)),
                "m"));

        assertThat(json.path("tool_choice").asText()).isEqualTo("auto");
        JsonNode tools = json.path("tools");
        assertThat(tools.get(0).path("type").asText()).isEqualTo("function");
        assertThat(tools.get(0).path("function").path("name").asText()).isEqualTo("read");
        assertThat(tools.get(0).path("function").path("description").asText()).isEqualTo("Read a file");
        assertThat(tools.get(0).path("function").path("parameters")).isEqualTo(schema);
        assertThat(tools.get(1).path("function").path("description").asText()).isEmpty();
    }

    // ── Response ─────────────────────────────────────────────────────────────

    @Test
    void stopBecomesTextDecisionWithUsage() {
        ModelReply reply = codec.toReply("""
                {"id":"x","choices":[{"index":0,"finish_reason":"stop",
                  "message":{"role":"assistant","content":"hello"}}],
                 "usage":{"prompt_tokens":7,"completion_tokens":2,"total_tokens":9}}
                """);

        assertThat(reply.decisions()).containsExactly(new ModelDecision.TextMessage("hello"));
        assertThat(reply.usage()).isEqualTo(new UsageTokens(2, 7, 9));
    }

    @Test
    void toolCallsAreDecodedWithParsedArguments() throws Exception {
        ModelReply reply = codec.toReply("""
                {"choices":[{"finish_reason":"tool_calls","message":{"role":"assistant","content":null,
                  "tool_calls":[
                    {"id":"a","type":"function","function":{"name":"weather","arguments":"{\\"city\\":\\"Oslo\\"}"}},
                    {"id":"b","type":"function","function":{"name":"time","arguments":""}}]}}]}
                """);

        assertThat(reply.decisions()).containsExactly(new ModelDecision.ToolCalls(List.of(
                new ToolCall("weather", "a", (ObjectNode) objectMapper.readTree("{\"city\":\"Oslo\"}")),
                new ToolCall("time", "b", null))));
        assertThat(reply.usage()).isEqualTo(UsageTokens.ZERO);
    }

    @Test
    void usesFirstOfSeveralChoices() {
        ModelReply reply = codec.toReply("""
                {"choices":[
                  {"finish_reason":"stop","message":{"role":"assistant","content":"first"}},
                  {"finish_reason":"stop","message":{"role":"assistant","content":"second"}}]}
                """);

        assertThat(reply.decisions()).containsExactly(new ModelDecision.TextMessage("first"));
    }

    @Test
    void rejectsUnexpectedShapes() {
        assertThatThrownBy(() -> codec.toReply("{\"choices\":[]}"))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.toReply(
                "{\"choices\":[{\"finish_reason\":\"length\",\"message\":{\"content\":\"cut\"}}]}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("length");
        assertThatThrownBy(() -> codec.toReply(
                "{\"choices\":[{\"finish_reason\":\"stop\",\"message\":{\"role\":\"assistant\"}}]}"))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.toReply(
                "{\"choices\":[{\"finish_reason\":\"tool_calls\",\"message\":{\"tool_calls\":[]}}]}"))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.toReply("not json"))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    void rejectsToolCallsWithoutUniqueIds() {
        assertThatThrownBy(() -> codec.toReply("""
                {"choices":[{"finish_reason":"tool_calls","message":{"tool_calls":[
                  {"type":"function","function":{"name":"read","arguments":"{}"}}]}}]}
                """))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("Model returned a tool call without id");
        assertThatThrownBy(() -> codec.toReply("""
                {"choices":[{"finish_reason":"tool_calls","message":{"tool_calls":[
                  {"id":" ","type":"function","function":{"name":"read","arguments":"{}"}}]}}]}
                """))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.toReply("""
                {"choices":[{"finish_reason":"tool_calls","message":{"tool_calls":[
                  {"id":"call_1","type":"function","function":{"name":"read","arguments":"{}"}},
                  {"id":"call_1","type":"function","function":{"name":"stat","arguments":"{}"}}]}}]}
                """))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("duplicate tool call id");
    }

    @Test
    void rejectsUndecodableArguments() {
        assertThatThrownBy(() -> codec.decodeArguments("{broken"))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.decodeArguments("[1,2]"))
                .isInstanceOf(ProtocolException.class);
        assertThat(codec.decodeArguments("null")).isNull();
    }
}
