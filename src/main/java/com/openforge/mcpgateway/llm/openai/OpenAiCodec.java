package com.openforge.mcpgateway.llm.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Translation between the canonical conversation and the OpenAI
 * chat-completions wire format, shared by every OpenAI-family adapter
 * (OpenAI itself, Azure, Anthropic's compatible endpoint).
 *
 * Outbound:
 *   TextMessage → {role, content}
 *   ToolCalls   → {role, tool_calls:[{id, type:"function", function:{name, arguments:"<json>"}}]}
 *   ToolOutput  → {role:"tool", tool_call_id, content}
 *
 * Inbound, first choice only:
 *   finish_reason "stop"       → TextMessage(content)
 *   finish_reason "tool_calls" → ToolCalls(parsed calls)
 *   anything else              → ProtocolException
 */
@Slf4j
public class OpenAiCodec {

    static final String FINISH_STOP       = "stop";
    static final String FINISH_TOOL_CALLS = "tool_calls";

    private final ObjectMapper objectMapper;
    private final String       providerName;

    public OpenAiCodec(ObjectMapper objectMapper, String providerName) {
        this.objectMapper = objectMapper;
        this.providerName = providerName;
    }

    // ── Request ──────────────────────────────────────────────────────────────

    /**
     * @param model model id to send, or null to omit the field
     */
    public ChatRequest toRequest(Conversation conversation, List<ToolSpec> tools, String model) {
        List<ChatMessage> messages = conversation.messages().stream()
                .map(this::toChatMessage)
                .toList();

        List<Tool> wireTools = tools == null || tools.isEmpty()
                ? null
                : tools.stream().map(this::toTool).toList();

        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .temperature(conversation.temperature())
                .maxTokens(conversation.maxTokens())
                .topP(conversation.topP())
                .tools(wireTools)
                .toolChoice(wireTools == null ? null : "auto")
                .build();
    }

    private ChatMessage toChatMessage(Message message) {
        if (message instanceof Message.TextMessage text) {
            return ChatMessage.builder()
                    .role(text.role().wireName())
                    .content(text.content())
                    .build();
        }
        if (message instanceof Message.ToolCalls calls) {
            return ChatMessage.builder()
                    .role(calls.role().wireName())
                    .toolCalls(calls.calls().stream()
                            .map(call -> ChatToolCall.ofFunction(call.id(),
                                    new FunctionCall(call.name(), encodeArguments(call.arguments()))))
                            .toList())
                    .build();
        }
        Message.ToolOutput output = (Message.ToolOutput) message;
        return ChatMessage.builder()
                .role("tool")
                .toolCallId(output.callId())
                .content(output.output())
                .build();
    }

    private Tool toTool(ToolSpec spec) {
        return Tool.ofFunction(new ToolFunction(spec.name(), describe(spec), spec.inputSchema()));
    }

    private String describe(ToolSpec spec) {
        if (spec.description() != null) {
            return spec.description();
        }
        log.warn("[{}] Tool \"{}\" doesn't have a description", providerName, spec.name());
        return "";
    }

    private String encodeArguments(ObjectNode arguments) {
        if (arguments == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Couldn't encode tool call arguments", e);
        }
    }

    // ── Response ─────────────────────────────────────────────────────────────

    public ModelReply toReply(String responseBody) {
        ChatResponse response;
        try {
            response = objectMapper.readValue(responseBody, ChatResponse.class);
        } catch (JsonProcessingException e) {
            log.error("[{}] Couldn't deserialize response: {}", providerName, e.getOriginalMessage());
            throw new ProtocolException("Unexpected response from model provider", e);
        }

        if (response.choices() == null || response.choices().isEmpty()) {
            log.error("[{}] Response without choices: {}", providerName, responseBody);
            throw new ProtocolException("Model returned no choices");
        }
        if (response.choices().size() > 1) {
            log.warn("[{}] Model gave {} choices, moving on with first one",
                    providerName, response.choices().size());
        }

        ChatResponse.Choice choice  = response.choices().get(0);
        ChatMessage         message = choice.message();
        if (message == null) {
            throw new ProtocolException("Model returned a choice without message");
        }

        ModelDecision decision;
        if (FINISH_STOP.equals(choice.finishReason())) {
            if (message.content() == null) {
                log.error("[{}] Unknown response needs to be handled: {}", providerName, responseBody);
                throw new ProtocolException("Model stopped without text content");
            }
            decision = new ModelDecision.TextMessage(message.content());
        } else if (FINISH_TOOL_CALLS.equals(choice.finishReason())) {
            if (message.toolCalls() == null || message.toolCalls().isEmpty()) {
                log.error("[{}] Unknown response needs to be handled: {}", providerName, responseBody);
                throw new ProtocolException("Model requested tool calls without any call");
            }
            List<ToolCall> calls = message.toolCalls().stream()
                    .map(this::toToolCall)
                    .toList();
            Set<String> ids = new HashSet<>();
            for (ToolCall call : calls) {
                if (!ids.add(call.id())) {
                    log.error("[{}] Duplicate tool call id \"{}\": {}", providerName, call.id(), responseBody);
                    throw new ProtocolException("Model returned duplicate tool call id: " + call.id());
                }
            }
            decision = new ModelDecision.ToolCalls(calls);
        } else {
            log.error("[{}] Unsupported finish reason \"{}\": {}", providerName, choice.finishReason(), responseBody);
            throw new ProtocolException("Unsupported finish reason: " + choice.finishReason());
        }

        return new ModelReply(List.of(decision), toUsage(response.usage()));
    }

    private ToolCall toToolCall(ChatToolCall call) {
        if (call.function() == null || call.function().name() == null) {
            throw new ProtocolException("Model returned a tool call without function name");
        }
        if (call.id() == null || call.id().isBlank()) {
            log.error("[{}] Tool call \"{}\" without id", providerName, call.function().name());
            throw new ProtocolException("Model returned a tool call without id");
        }
        return new ToolCall(call.function().name(), call.id(), decodeArguments(call.function().arguments()));
    }

    ObjectNode decodeArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return null;
        }
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            log.error("[{}] Unparsable tool call arguments: {}", providerName, arguments);
            throw new ProtocolException("Couldn't parse tool call arguments", e);
        }
        if (parsed == null || parsed.isNull()) {
            return null;
        }
        if (!parsed.isObject()) {
            throw new ProtocolException("Tool call arguments are not a JSON object");
        }
        return (ObjectNode) parsed;
    }

    private static UsageTokens toUsage(ChatResponse.Usage usage) {
        if (usage == null) {
            return UsageTokens.ZERO;
        }
        return new UsageTokens(usage.completionTokens(), usage.promptTokens(), usage.totalTokens());
    }
}
