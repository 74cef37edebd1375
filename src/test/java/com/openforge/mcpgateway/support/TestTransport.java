package com.openforge.mcpgateway.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mcpgateway.auth.TransportContext;
import com.openforge.mcpgateway.config.AppConfig;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/** Transport plumbing configured like the application's own beans. */
public final class TestTransport {

    private TestTransport() {}

    public static ObjectMapper objectMapper() {
        return new AppConfig().objectMapper();
    }

    public static TransportContext context() {
        return context(Clock.systemUTC());
    }

    public static TransportContext context(Clock clock) {
        return new TransportContext(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build(),
                objectMapper(),
                Duration.ofSeconds(5),
                clock);
    }
}
