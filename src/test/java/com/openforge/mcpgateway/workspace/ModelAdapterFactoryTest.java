package com.openforge.mcpgateway.workspace;

import com.openforge.mcpgateway.auth.Auth;
import com.openforge.mcpgateway.auth.AuthLocation;
import com.openforge.mcpgateway.config.GatewayProperties.AuthConfig;
import com.openforge.mcpgateway.config.GatewayProperties.ModelConfig;
import com.openforge.mcpgateway.error.ConfigurationException;
import com.openforge.mcpgateway.llm.ModelAdapter;
import com.openforge.mcpgateway.llm.ResilientModelAdapter;
import com.openforge.mcpgateway.support.TestTransport;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelAdapterFactoryTest {

    private final CircuitBreakerRegistry circuitBreakers = CircuitBreakerRegistry.ofDefaults();
    private final RetryRegistry          retries         = RetryRegistry.ofDefaults();
    private final ModelAdapterFactory    factory         =
            new ModelAdapterFactory(TestTransport.context(), circuitBreakers, retries);

    // ── Auth ─────────────────────────────────────────────────────────────────

    @Test
    void headerKeyIsJoinedWithItsPrefix() {
        Auth auth = ModelAdapterFactory.toAuth("openai",
                apiKey("header", "Authorization", "sk-1", "Bearer"));

        assertThat(auth).isEqualTo(new Auth.ApiKey(new AuthLocation.Header("Authorization", "Bearer sk-1")));
    }

    @Test
    void parameterKeyIgnoresPrefix() {
        Auth auth = ModelAdapterFactory.toAuth("gemini", apiKey("parameter", "key", "g-1", null));

        assertThat(auth).isEqualTo(new Auth.ApiKey(new AuthLocation.Params("key", "g-1")));
    }

    @Test
    void oauth2CarriesItsClientCredentials() {
        Auth auth = ModelAdapterFactory.toAuth("corp", new AuthConfig("oauth2", null, null, null, null,
                "https://login.example.test/token", "id", "secret", "models.read"));

        assertThat(auth).isEqualTo(new Auth.OAuth2("https://login.example.test/token", "id", "secret", "models.read"));
    }

    @Test
    void missingAuthMeansNone() {
        assertThat(ModelAdapterFactory.toAuth("local", null)).isInstanceOf(Auth.None.class);
    }

    @Test
    void rejectsUnknownAuth() {
        assertThatThrownBy(() -> ModelAdapterFactory.toAuth("x",
                new AuthConfig("kerberos", null, null, null, null, null, null, null, null)))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> ModelAdapterFactory.toAuth("x", apiKey("cookie", "k", "v", null)))
                .isInstanceOf(ConfigurationException.class);
    }

    // ── Adapters ─────────────────────────────────────────────────────────────

    @Test
    void everyAdapterIsWrappedInItsOwnResilience() {
        ModelAdapter adapter = factory.create("gpt", new ModelConfig("openai",
                "https://api.openai.test/v1/chat/completions", "gpt-4o", null, null,
                apiKey("header", "Authorization", "sk-1", "Bearer")));

        assertThat(adapter).isInstanceOf(ResilientModelAdapter.class);
        assertThat(adapter.name()).isEqualTo("gpt");
        assertThat(circuitBreakers.find("gpt")).isPresent();
        assertThat(retries.find("gpt")).isPresent();
    }

    @Test
    void buildsEverySupportedType() {
        assertThat(factory.create("g", new ModelConfig("Gemini", "https://gemini.test/generate",
                null, null, null, apiKey("parameter", "key", "g-1", null))).name()).isEqualTo("g");
        assertThat(factory.create("az", new ModelConfig("azure", "https://azure.test/chat/completions",
                null, "2024-06-01", null, apiKey("header", "api-key", "a-1", null))).name()).isEqualTo("az");
        assertThat(factory.create("claude", new ModelConfig("anthropic", "https://anthropic.test/v1/chat/completions",
                "claude-sonnet", null, "2023-06-01", apiKey("header", "x-api-key", "c-1", null))).name())
                .isEqualTo("claude");
    }

    @Test
    void rejectsInvalidModels() {
        assertThatThrownBy(() -> factory.create("m", new ModelConfig("mistral", "https://m.test", null, null, null, null)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown type");
        assertThatThrownBy(() -> factory.create("m", new ModelConfig("openai", "https://o.test", null, null, null, null)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing model id");
        assertThatThrownBy(() -> factory.create("az", new ModelConfig("azure", "https://azure.test/chat",
                null, "2024-06-01", null, apiKey("parameter", "api-key", "a-1", null))))
                .isInstanceOf(ConfigurationException.class);
    }

    private static AuthConfig apiKey(String location, String name, String value, String prefix) {
        return new AuthConfig("apikey", location, name, value, prefix, null, null, null, null);
    }
}
