package com.openforge.mcpgateway.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.mcpgateway.auth.TransportContext;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Core infrastructure beans:
 *  - gateway executor   → runs every agent loop so the TimeLimiter can bound it
 *  - Java HttpClient    → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java 8 time, tolerant deserialization
 *  - TransportContext   → the above bundled for every CredentialManager
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class AppConfig {

    /**
     * Bounded platform-thread pool; each running request holds one thread
     * for the duration of its loop.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService gatewayExecutor(GatewayProperties properties) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                properties.workerThreads(), properties.workerThreads(),
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new CustomizableThreadFactory("gateway-loop-"));
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Single, shared HttpClient instance.
     * Connect timeout from gateway.http-timeout; per-request read timeouts
     * are set at call site.
     */
    @Bean
    public HttpClient httpClient(GatewayProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.httpTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (tool_calls, finish_reason …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (API can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransportContext transportContext(HttpClient httpClient, ObjectMapper objectMapper,
                                             GatewayProperties properties, Clock clock) {
        return new TransportContext(httpClient, objectMapper, properties.httpTimeout(), clock);
    }
}
