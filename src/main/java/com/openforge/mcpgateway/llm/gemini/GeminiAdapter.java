package com.openforge.mcpgateway.llm.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mcpgateway.auth.Auth;
import com.openforge.mcpgateway.auth.CredentialManager;
import com.openforge.mcpgateway.auth.TransportContext;
import com.openforge.mcpgateway.conversation.Conversation;
import com.openforge.mcpgateway.conversation.Message;
import com.openforge.mcpgateway.conversation.ModelDecision;
import com.openforge.mcpgateway.conversation.ModelReply;
import com.openforge.mcpgateway.conversation.Role;
import com.openforge.mcpgateway.conversation.ToolCall;
import com.openforge.mcpgateway.conversation.ToolSpec;
import com.openforge.mcpgateway.conversation.UsageTokens;
import com.openforge.mcpgateway.error.InvalidConversationException;
import com.openforge.mcpgateway.error.ProtocolException;
import com.openforge.mcpgateway.llm.ModelAdapter;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Adapter for Google Gemini's generateContent endpoint.
 *
 * Request mapping:
 *   User text         → {role:"user",  parts:[{text}]}
 *   Assistant text    → {role:"model", parts:[{text}]}
 *   System text       → systemInstruction (Gemini has no system role)
 *   ToolCalls         → {role:"model", parts:[{functionCall}...]}
 *   ToolOutput        → functionResponse part, merged into the entry right
 *                       before it when that entry holds function calls or
 *                       function responses, otherwise a new "function" entry
 *
 * Response mapping, parts walked in order:
 *   text                      → TextMessage decision
 *   run of functionCall parts → one ToolCalls decision, ids generated here
 *
 * Gemini rejects "$schema" and "additionalProperties" in tool schemas, so
 * both are stripped at every depth.
 */
@Slf4j
public class GeminiAdapter implements ModelAdapter {

    static final String FINISH_STOP = "STOP";
    static final int    ID_LENGTH   = 24;

    private static final String ID_ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final List<String> REJECTED_SCHEMA_KEYS = List.of("$schema", "additionalProperties");

    private final String            name;
    private final CredentialManager credentials;
    private final ObjectMapper      objectMapper;
    private final SecureRandom      random = new SecureRandom();

    GeminiAdapter(String name, CredentialManager credentials, ObjectMapper objectMapper) {
        this.name         = name;
        this.credentials  = credentials;
        this.objectMapper = objectMapper;
    }

    public static GeminiAdapter create(String name, TransportContext context, String url, Auth auth) {
        return new GeminiAdapter(name,
                CredentialManager.create(context, url, auth, Map.of(), Map.of()),
                context.objectMapper());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ModelReply call(Conversation conversation, List<ToolSpec> tools) {
        GeminiRequest request = toRequest(conversation, tools);
        log.debug("[Gemini:{}] → POST {} contents={} tools={}",
                name, credentials.uri().getPath(), request.contents().size(),
                tools == null ? 0 : tools.size());

        ModelReply reply = toReply(credentials.call(request));
        log.debug("[Gemini:{}] ← decisions={} usage={}", name, reply.decisions().size(), reply.usage());
        return reply;
    }

    // ── Request ──────────────────────────────────────────────────────────────

    GeminiRequest toRequest(Conversation conversation, List<ToolSpec> tools) {
        List<Content>       contents      = new ArrayList<>();
        List<Part>          systemParts   = new ArrayList<>();
        Map<String, String> callNames     = new HashMap<>();
        // Parts of the last entry a functionResponse may be merged into; null after text.
        List<Part>          mergeTarget   = null;

        for (Message message : conversation.messages()) {
            if (message instanceof Message.TextMessage text) {
                mergeTarget = null;
                switch (text.role()) {
                    case SYSTEM    -> systemParts.add(Part.ofText(text.content()));
                    case USER      -> contents.add(entry(Content.ROLE_USER, Part.ofText(text.content())));
                    case ASSISTANT -> contents.add(entry(Content.ROLE_MODEL, Part.ofText(text.content())));
                    case TOOL      -> throw new InvalidConversationException(
                            "Gemini doesn't accept text messages with role \"tool\"");
                }
            } else if (message instanceof Message.ToolCalls calls) {
                if (calls.role() != Role.ASSISTANT) {
                    throw new InvalidConversationException(
                            "Tool calls must come from the assistant, got \"%s\"".formatted(calls.role().wireName()));
                }
                List<Part> parts = new ArrayList<>();
                for (ToolCall call : calls.calls()) {
                    callNames.put(call.id(), call.name());
                    parts.add(Part.ofCall(call.name(), call.arguments()));
                }
                contents.add(new Content(Content.ROLE_MODEL, parts));
                mergeTarget = parts;
            } else {
                Message.ToolOutput output = (Message.ToolOutput) message;
                Part response = Part.ofResponse(
                        callNames.getOrDefault(output.callId(), output.callId()), output.output());
                if (mergeTarget != null) {
                    mergeTarget.add(response);
                } else {
                    List<Part> parts = new ArrayList<>();
                    parts.add(response);
                    contents.add(new Content(Content.ROLE_FUNCTION, parts));
                    mergeTarget = parts;
                }
            }
        }

        List<GeminiRequest.Tool> wireTools = tools == null || tools.isEmpty()
                ? null
                : List.of(new GeminiRequest.Tool(tools.stream().map(this::toDeclaration).toList()));

        return new GeminiRequest(
                contents,
                systemParts.isEmpty() ? null : new Content(null, systemParts),
                wireTools,
                GeminiRequest.GenerationConfig.of(
                        conversation.temperature(), conversation.maxTokens(), conversation.topP()));
    }

    private static Content entry(String role, Part part) {
        List<Part> parts = new ArrayList<>();
        parts.add(part);
        return new Content(role, parts);
    }

    private GeminiRequest.FunctionDeclaration toDeclaration(ToolSpec spec) {
        String description = spec.description();
        if (description == null) {
            log.warn("[Gemini:{}] Tool \"{}\" doesn't have a description", name, spec.name());
            description = "";
        }
        ObjectNode schema = spec.inputSchema() == null
                ? objectMapper.createObjectNode()
                : spec.inputSchema().deepCopy();
        stripRejectedKeys(schema);
        return new GeminiRequest.FunctionDeclaration(spec.name(), description, schema);
    }

    static void stripRejectedKeys(JsonNode node) {
        if (node.isObject()) {
            ((ObjectNode) node).remove(REJECTED_SCHEMA_KEYS);
            Iterator<JsonNode> children = node.elements();
            while (children.hasNext()) {
                stripRejectedKeys(children.next());
            }
        } else if (node.isArray()) {
            node.forEach(GeminiAdapter::stripRejectedKeys);
        }
    }

    // ── Response ─────────────────────────────────────────────────────────────

    ModelReply toReply(String responseBody) {
        GeminiResponse response;
        try {
            response = objectMapper.readValue(responseBody, GeminiResponse.class);
        } catch (JsonProcessingException e) {
            log.error("[Gemini:{}] Couldn't deserialize response: {}", name, e.getOriginalMessage());
            throw new ProtocolException("Unexpected response from model provider", e);
        }

        if (response.candidates() == null || response.candidates().isEmpty()) {
            log.error("[Gemini:{}] Response without candidates: {}", name, responseBody);
            throw new ProtocolException("Model returned no candidates");
        }
        if (response.candidates().size() > 1) {
            log.warn("[Gemini:{}] Model gave {} candidates, moving on with first one",
                    name, response.candidates().size());
        }

        GeminiResponse.Candidate candidate = response.candidates().get(0);
        if (!FINISH_STOP.equals(candidate.finishReason())) {
            log.error("[Gemini:{}] Unsupported finish reason \"{}\": {}", name, candidate.finishReason(), responseBody);
            throw new ProtocolException("Unsupported finish reason: " + candidate.finishReason());
        }
        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            throw new ProtocolException("Model returned a candidate without parts");
        }

        List<ModelDecision> decisions = new ArrayList<>();
        List<ToolCall>      run       = null;
        for (Part part : candidate.content().parts()) {
            if (part.text() != null) {
                closeRun(decisions, run);
                run = null;
                decisions.add(new ModelDecision.TextMessage(part.text()));
            } else if (part.functionCall() != null && part.functionCall().name() != null) {
                if (run == null) {
                    run = new ArrayList<>();
                }
                run.add(new ToolCall(part.functionCall().name(), newCallId(), part.functionCall().args()));
            } else {
                log.error("[Gemini:{}] Part not supported: {}", name, part);
                throw new ProtocolException("Unsupported content part in model response");
            }
        }
        closeRun(decisions, run);

        return new ModelReply(decisions, toUsage(response.usageMetadata()));
    }

    private static void closeRun(List<ModelDecision> decisions, List<ToolCall> run) {
        if (run != null) {
            decisions.add(new ModelDecision.ToolCalls(run));
        }
    }

    String newCallId() {
        StringBuilder id = new StringBuilder(ID_LENGTH);
        for (int i = 0; i < ID_LENGTH; i++) {
            id.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return id.toString();
    }

    private static UsageTokens toUsage(GeminiResponse.UsageMetadata usage) {
        if (usage == null) {
            return UsageTokens.ZERO;
        }
        return new UsageTokens(usage.candidatesTokenCount(), usage.promptTokenCount(), usage.totalTokenCount());
    }
}
