package com.openforge.mcpgateway.workspace;

import com.openforge.mcpgateway.auth.Auth;
import com.openforge.mcpgateway.auth.AuthLocation;
import com.openforge.mcpgateway.auth.TransportContext;
import com.openforge.mcpgateway.config.GatewayProperties.AuthConfig;
import com.openforge.mcpgateway.config.GatewayProperties.ModelConfig;
import com.openforge.mcpgateway.error.ConfigurationException;
import com.openforge.mcpgateway.llm.ModelAdapter;
import com.openforge.mcpgateway.llm.ResilientModelAdapter;
import com.openforge.mcpgateway.llm.gemini.GeminiAdapter;
import com.openforge.mcpgateway.llm.openai.AnthropicAdapter;
import com.openforge.mcpgateway.llm.openai.AzureAdapter;
import com.openforge.mcpgateway.llm.openai.OpenAiAdapter;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Turns one "gateway.models" entry into a ready {@link ModelAdapter},
 * wrapped in the model's own circuit breaker and retry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelAdapterFactory {

    private final TransportContext       transportContext;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry          retryRegistry;

    public ModelAdapter create(String name, ModelConfig config) {
        if (config.type() == null) {
            throw new ConfigurationException("Model \"%s\": missing type".formatted(name));
        }
        Auth auth = toAuth(name, config.auth());

        ModelAdapter adapter = switch (config.type().toLowerCase(Locale.ROOT)) {
            case "openai"    -> OpenAiAdapter.create(name, transportContext, config.url(),
                                        requireModel(name, config), auth);
            case "azure"     -> AzureAdapter.create(name, transportContext, config.url(),
                                        config.apiVersion(), auth);
            case "anthropic" -> AnthropicAdapter.create(name, transportContext, config.url(),
                                        requireModel(name, config), config.anthropicVersion(), auth);
            case "gemini"    -> GeminiAdapter.create(name, transportContext, config.url(), auth);
            default -> throw new ConfigurationException(
                    "Model \"%s\": unknown type \"%s\"".formatted(name, config.type()));
        };
        log.debug("[Config] Model \"{}\" → {} {}", name, config.type(), config.url());

        return new ResilientModelAdapter(adapter,
                circuitBreakerRegistry.circuitBreaker(name),
                retryRegistry.retry(name));
    }

    static Auth toAuth(String owner, AuthConfig config) {
        if (config == null || config.type() == null) {
            return Auth.none();
        }
        switch (config.type().toLowerCase(Locale.ROOT)) {
            case "apikey": {
                if (config.name() == null || config.value() == null) {
                    throw new ConfigurationException("\"%s\": apikey auth needs name and value".formatted(owner));
                }
                String location = config.location() == null ? "header" : config.location().toLowerCase(Locale.ROOT);
                if ("header".equals(location)) {
                    String value = config.prefix() == null || config.prefix().isBlank()
                            ? config.value()
                            : config.prefix() + " " + config.value();
                    return new Auth.ApiKey(new AuthLocation.Header(config.name(), value));
                }
                if ("parameter".equals(location)) {
                    return new Auth.ApiKey(new AuthLocation.Params(config.name(), config.value()));
                }
                throw new ConfigurationException(
                        "\"%s\": unknown apikey location \"%s\"".formatted(owner, config.location()));
            }
            case "oauth2": {
                if (config.url() == null || config.clientId() == null || config.clientSecret() == null) {
                    throw new ConfigurationException(
                            "\"%s\": oauth2 auth needs url, client-id and client-secret".formatted(owner));
                }
                return new Auth.OAuth2(config.url(), config.clientId(), config.clientSecret(), config.scope());
            }
            default:
                throw new ConfigurationException(
                        "\"%s\": unknown auth type \"%s\"".formatted(owner, config.type()));
        }
    }

    private static String requireModel(String name, ModelConfig config) {
        if (config.model() == null || config.model().isBlank()) {
            throw new ConfigurationException("Model \"%s\": missing model id".formatted(name));
        }
        return config.model();
    }
}
