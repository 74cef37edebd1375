package com.openforge.mcpgateway.config;

import com.openforge.mcpgateway.error.TransportException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One circuit breaker and one retry per configured model, created on demand
 * from the registries under the model's name (see ModelAdapterFactory), plus
 * the single TimeLimiter that bounds a whole request.
 */
@Configuration
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // treat slow calls (>60 s) as failures
                .slowCallDurationThreshold(Duration.ofSeconds(60))
                .slowCallRateThreshold(80)
                // allow 2 probe calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                // network failures and upstream 5xx count; 4xx answers do not
                .recordException(e -> e instanceof TransportException te
                        && (te.isNetworkFailure() || te.getStatus() >= 500))
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(1))
                // network-level failures only
                .retryOnException(e -> e instanceof TransportException te && te.isNetworkFailure())
                .build();

        return RetryRegistry.of(config);
    }

    // ── Time Limiter ─────────────────────────────────────────────────────────

    @Bean
    public TimeLimiter requestTimeLimiter(GatewayProperties properties) {
        return TimeLimiter.of("request", TimeLimiterConfig.custom()
                .timeoutDuration(properties.requestTimeout())
                .cancelRunningFuture(true)
                .build());
    }
}
