package com.openforge.mcpgateway.llm.openai;

import com.openforge.mcpgateway.auth.Auth;
import com.openforge.mcpgateway.auth.AuthLocation;
import com.openforge.mcpgateway.auth.CredentialManager;
import com.openforge.mcpgateway.auth.TransportContext;
import com.openforge.mcpgateway.error.ConfigurationException;

import java.util.Map;

/**
 * Azure-hosted OpenAI deployment.
 *
 * The deployment URL already selects the model, so no "model" field is
 * sent; the API version travels as the {@code api-version} query
 * parameter.  Azure keys are only accepted in a header.
 */
public class AzureAdapter extends OpenAiAdapter {

    static final String API_VERSION_PARAM = "api-version";

    private AzureAdapter(String name, CredentialManager credentials, OpenAiCodec codec) {
        super(name, null, credentials, codec);
    }

    /**
     * @throws ConfigurationException unless {@code auth} is an API key sent as a header
     */
    public static AzureAdapter create(String name, TransportContext context,
                                      String url, String apiVersion, Auth auth) {
        if (!(auth instanceof Auth.ApiKey apiKey) || !(apiKey.location() instanceof AuthLocation.Header)) {
            throw new ConfigurationException(
                    "Model \"%s\": Azure only supports an API key sent as a header".formatted(name));
        }
        if (apiVersion == null || apiVersion.isBlank()) {
            throw new ConfigurationException("Model \"%s\": missing api-version".formatted(name));
        }
        CredentialManager credentials = CredentialManager.create(context, url, auth,
                Map.of(), Map.of(API_VERSION_PARAM, apiVersion));
        return new AzureAdapter(name, credentials, new OpenAiCodec(context.objectMapper(), "Azure:" + name));
    }
}
