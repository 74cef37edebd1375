package com.openforge.mcpgateway.auth;

import com.openforge.mcpgateway.error.ConfigurationException;
import com.openforge.mcpgateway.error.TransportException;
import com.openforge.mcpgateway.support.MutableClock;
import com.openforge.mcpgateway.support.StubHttpServer;
import com.openforge.mcpgateway.support.StubHttpServer.Reply;
import com.openforge.mcpgateway.support.TestTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialManagerTest {

    private StubHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = StubHttpServer.start()
                .on("/v1/chat", request -> Reply.json("{\"ok\":true}"));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    // ── API keys ─────────────────────────────────────────────────────────────

    @Test
    void headerKeyIsSentOnEveryCall() {
        CredentialManager manager = CredentialManager.create(TestTransport.context(), server.url("/v1/chat"),
                new Auth.ApiKey(new AuthLocation.Header("Authorization", "Bearer sk-test")), null, null);

        String response = manager.call(Map.of("hello", "world"));

        assertThat(response).isEqualTo("{\"ok\":true}");
        StubHttpServer.Captured request = server.requests().get(0);
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.header("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.header("Content-Type")).isEqualTo("application/json");
        assertThat(request.body()).isEqualTo("{\"hello\":\"world\"}");
    }

    @Test
    void parameterKeyAndExtraParamsGoIntoTheQuery() {
        CredentialManager manager = CredentialManager.create(TestTransport.context(), server.url("/v1/chat"),
                new Auth.ApiKey(new AuthLocation.Params("key", "a b&c")),
                Map.of("x-extra", "1"), Map.of("api-version", "2024-10-21"));

        manager.call(Map.of());

        StubHttpServer.Captured request = server.requests().get(0);
        assertThat(request.uri().getRawQuery()).contains("api-version=2024-10-21").contains("key=a+b%26c");
        assertThat(request.header("x-extra")).isEqualTo("1");
        assertThat(request.header("Authorization")).isNull();
    }

    @Test
    void existingQueryIsKept() {
        URI uri = CredentialManager.parseUrl("https://example.com/path?alt=json", Map.of("key", "k"));

        assertThat(uri.toString()).isEqualTo("https://example.com/path?alt=json&key=k");
    }

    @Test
    void invalidUrlIsAConfigurationError() {
        assertThatThrownBy(() -> CredentialManager.create(TestTransport.context(), "not a url", Auth.none(), null, null))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CredentialManager.create(TestTransport.context(), "ftp://example.com", Auth.none(), null, null))
                .isInstanceOf(ConfigurationException.class);
    }

    // ── Failures ─────────────────────────────────────────────────────────────

    @Test
    void upstreamStatusIsCarriedOver() {
        server.on("/limited", request -> new Reply(429, "{\"error\":\"slow down\"}"));
        CredentialManager manager = CredentialManager.create(TestTransport.context(), server.url("/limited"),
                Auth.none(), null, null);

        assertThatThrownBy(() -> manager.call(Map.of()))
                .isInstanceOfSatisfying(TransportException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(429);
                    assertThat(e.isNetworkFailure()).isFalse();
                });
    }

    @Test
    void unreachableUpstreamIsANetworkFailure() throws Exception {
        StubHttpServer closed = StubHttpServer.start();
        String url = closed.url("/gone");
        closed.close();
        CredentialManager manager = CredentialManager.create(TestTransport.context(), url, Auth.none(), null, null);

        assertThatThrownBy(() -> manager.call(Map.of()))
                .isInstanceOfSatisfying(TransportException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(500);
                    assertThat(e.isNetworkFailure()).isTrue();
                });
    }

    // ── OAuth2 ───────────────────────────────────────────────────────────────

    @Test
    void tokenIsReusedWithinItsLifetimeAndRenewedAfterExpiry() {
        AtomicInteger issued = new AtomicInteger();
        server.on("/token", request -> Reply.json(
                "{\"access_token\":\"tok-%d\",\"expires_in\":60,\"token_type\":\"Bearer\"}"
                        .formatted(issued.incrementAndGet())));
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        CredentialManager manager = CredentialManager.create(TestTransport.context(clock), server.url("/v1/chat"),
                new Auth.OAuth2(server.url("/token"), "gateway", "s3cret", "llm.invoke"), null, null);

        manager.call(Map.of());
        clock.advance(Duration.ofSeconds(30));
        manager.call(Map.of());

        assertThat(server.requests("/token")).hasSize(1);
        assertThat(server.requests("/v1/chat")).extracting(r -> r.header("Authorization"))
                .containsExactly("Bearer tok-1", "Bearer tok-1");

        clock.advance(Duration.ofSeconds(31));
        manager.call(Map.of());

        assertThat(server.requests("/token")).hasSize(2);
        assertThat(server.requests("/v1/chat").get(2).header("Authorization")).isEqualTo("Bearer tok-2");
    }

    @Test
    void tokenRequestUsesClientCredentialsWithBasicAuth() {
        server.on("/token", request -> Reply.json("{\"access_token\":\"t\",\"expires_in\":3600}"));
        CredentialManager manager = CredentialManager.create(TestTransport.context(), server.url("/v1/chat"),
                new Auth.OAuth2(server.url("/token"), "gateway", "s3cret", "a b"), null, null);

        manager.call(Map.of());

        StubHttpServer.Captured token = server.requests("/token").get(0);
        String expected = Base64.getEncoder().encodeToString("gateway:s3cret".getBytes(StandardCharsets.UTF_8));
        assertThat(token.header("Authorization")).isEqualTo("Basic " + expected);
        assertThat(token.header("Content-Type")).isEqualTo("application/x-www-form-urlencoded");
        assertThat(token.body()).isEqualTo("grant_type=client_credentials&scope=a+b");
    }

    @Test
    void failedTokenRenewalIsA500() {
        server.on("/token", request -> new Reply(401, "{\"error\":\"invalid_client\"}"));
        CredentialManager manager = CredentialManager.create(TestTransport.context(), server.url("/v1/chat"),
                new Auth.OAuth2(server.url("/token"), "gateway", "wrong", null), null, null);

        assertThatThrownBy(() -> manager.call(Map.of()))
                .isInstanceOfSatisfying(TransportException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(500);
                    assertThat(e.getMessage()).isEqualTo("Couldn't renew token");
                });
        assertThat(server.requests("/v1/chat")).isEmpty();
    }

    @Test
    void tokenResponseWithoutExpiryIsRejected() {
        server.on("/token", request -> Reply.json("{\"access_token\":\"t\"}"));
        CredentialManager manager = CredentialManager.create(TestTransport.context(), server.url("/v1/chat"),
                new Auth.OAuth2(server.url("/token"), "gateway", "s3cret", null), null, null);

        assertThatThrownBy(() -> manager.call(Map.of()))
                .isInstanceOf(TransportException.class)
                .hasMessage("Couldn't renew token");
    }

    // ── OAuth2 under concurrency ─────────────────────────────────────────────

    @Test
    void callersRacingPastExpiryShareOneRenewal() throws Exception {
        AtomicInteger issued = new AtomicInteger();
        server.on("/token", request -> Reply.json(
                "{\"access_token\":\"tok-%d\",\"expires_in\":60}".formatted(issued.incrementAndGet())));
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        CredentialManager manager = CredentialManager.create(TestTransport.context(clock), server.url("/v1/chat"),
                new Auth.OAuth2(server.url("/token"), "gateway", "s3cret", null), null, null);
        manager.call(Map.of());
        clock.advance(Duration.ofSeconds(61));

        int            callers = 8;
        CountDownLatch start   = new CountDownLatch(1);
        ExecutorService pool   = Executors.newFixedThreadPool(callers);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return manager.call(Map.of());
                }));
            }
            start.countDown();
            for (Future<String> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo("{\"ok\":true}");
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(server.requests("/token")).hasSize(2);
        assertThat(server.requests("/v1/chat")).hasSize(callers + 1);
        assertThat(server.requests("/v1/chat").subList(1, callers + 1))
                .extracting(r -> r.header("Authorization"))
                .containsOnly("Bearer tok-2");
    }

    @Test
    void slowUpstreamCallDoesNotBlockOtherCallers() throws Exception {
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicInteger  calls        = new AtomicInteger();
        server.on("/token", request -> Reply.json("{\"access_token\":\"t\",\"expires_in\":3600}"));
        server.on("/v1/slow", request -> {
            if (calls.incrementAndGet() == 1) {
                firstEntered.countDown();
                try {
                    releaseFirst.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return Reply.json("{\"ok\":true}");
        });
        CredentialManager manager = CredentialManager.create(TestTransport.context(), server.url("/v1/slow"),
                new Auth.OAuth2(server.url("/token"), "gateway", "s3cret", null), null, null);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<String> slow = pool.submit(() -> manager.call(Map.of()));
            assertThat(firstEntered.await(5, TimeUnit.SECONDS)).isTrue();

            Future<String> fast = pool.submit(() -> manager.call(Map.of()));

            assertThat(fast.get(3, TimeUnit.SECONDS)).isEqualTo("{\"ok\":true}");
            assertThat(slow.isDone()).isFalse();
            releaseFirst.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS)).isEqualTo("{\"ok\":true}");
        } finally {
            releaseFirst.countDown();
            pool.shutdownNow();
        }
        assertThat(server.requests("/token")).hasSize(1);
        assertThat(server.requests("/v1/slow")).extracting(r -> r.header("Authorization"))
                .containsOnly("Bearer t");
    }
}
