package com.openforge.mcpgateway.llm.openai;

import com.openforge.mcpgateway.auth.Auth;
import com.openforge.mcpgateway.auth.CredentialManager;
import com.openforge.mcpgateway.auth.TransportContext;
import com.openforge.mcpgateway.error.ConfigurationException;

import java.util.Map;

/**
 * Anthropic through its OpenAI-compatible endpoint: the OpenAI body plus
 * an {@code anthropic-version} header on every call.
 */
public class AnthropicAdapter extends OpenAiAdapter {

    static final String VERSION_HEADER = "anthropic-version";

    private AnthropicAdapter(String name, String model, CredentialManager credentials, OpenAiCodec codec) {
        super(name, model, credentials, codec);
    }

    public static AnthropicAdapter create(String name, TransportContext context,
                                          String url, String model, String anthropicVersion, Auth auth) {
        if (anthropicVersion == null || anthropicVersion.isBlank()) {
            throw new ConfigurationException("Model \"%s\": missing anthropic-version".formatted(name));
        }
        CredentialManager credentials = CredentialManager.create(context, url, auth,
                Map.of(VERSION_HEADER, anthropicVersion), Map.of());
        return new AnthropicAdapter(name, model, credentials,
                new OpenAiCodec(context.objectMapper(), "Anthropic:" + name));
    }
}
