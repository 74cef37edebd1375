package com.openforge.mcpgateway.llm.openai;

import com.openforge.mcpgateway.auth.Auth;
import com.openforge.mcpgateway.auth.CredentialManager;
import com.openforge.mcpgateway.auth.TransportContext;
import com.openforge.mcpgateway.conversation.Conversation;
import com.openforge.mcpgateway.conversation.ModelReply;
import com.openforge.mcpgateway.conversation.ToolSpec;
import com.openforge.mcpgateway.llm.ModelAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Adapter for any OpenAI-compatible /chat/completions endpoint.
 *
 * Stateless apart from the bound {@link CredentialManager}: every call
 * encodes the whole conversation, POSTs it and decodes the single reply.
 * {@link AzureAdapter} and {@link AnthropicAdapter} reuse this flow and
 * only differ in how the endpoint is bound.
 */
@Slf4j
public class OpenAiAdapter implements ModelAdapter {

    private final String            name;
    private final String            model;
    private final CredentialManager credentials;
    private final OpenAiCodec       codec;

    protected OpenAiAdapter(String name, String model, CredentialManager credentials, OpenAiCodec codec) {
        this.name        = name;
        this.model       = model;
        this.credentials = credentials;
        this.codec       = codec;
    }

    public static OpenAiAdapter create(String name, TransportContext context,
                                       String url, String model, Auth auth) {
        CredentialManager credentials = CredentialManager.create(context, url, auth, Map.of(), Map.of());
        return new OpenAiAdapter(name, model, credentials,
                new OpenAiCodec(context.objectMapper(), "OpenAI:" + name));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ModelReply call(Conversation conversation, List<ToolSpec> tools) {
        ChatRequest request = codec.toRequest(conversation, tools, model);
        log.debug("[{}:{}] → POST {} messages={} tools={}",
                getClass().getSimpleName(), name, credentials.uri().getPath(), request.messages().size(),
                request.tools() == null ? 0 : request.tools().size());

        ModelReply reply = codec.toReply(credentials.call(request));
        log.debug("[{}:{}] ← decisions={} usage={}", getClass().getSimpleName(), name, reply.decisions().size(), reply.usage());
        return reply;
    }
}
