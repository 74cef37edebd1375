package com.openforge.mcpgateway.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.mcpgateway.error.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Client-credentials token cache.
 *
 * {@link #currentToken()} is the only critical section: lock, compare the
 * cached expiry with the clock, fetch and store a new token if it has
 * expired, unlock.  The upstream call that uses the token happens after the
 * lock is released.  The cache starts expired, so the first call fetches.
 */
@Slf4j
class OAuth2TokenSource {

    static final String RENEW_FAILED = "Couldn't renew token";

    private final TransportContext context;
    private final URI              tokenUri;
    private final String           clientId;
    private final String           clientSecret;
    private final String           scope;

    private final ReentrantLock lock = new ReentrantLock();
    private String  token;
    private Instant expiry = Instant.EPOCH;

    OAuth2TokenSource(TransportContext context, URI tokenUri,
                      String clientId, String clientSecret, String scope) {
        this.context      = context;
        this.tokenUri     = tokenUri;
        this.clientId     = clientId;
        this.clientSecret = clientSecret;
        this.scope        = scope;
    }

    String currentToken() {
        lock.lock();
        try {
            if (!context.clock().instant().isBefore(expiry)) {
                refresh();
            }
            return token;
        } finally {
            lock.unlock();
        }
    }

    // ── Token endpoint ───────────────────────────────────────────────────────

    private void refresh() {
        log.debug("[OAuth2] Token expired at {}, requesting a new one from {}", expiry, tokenUri);

        StringBuilder form = new StringBuilder("grant_type=client_credentials");
        if (scope != null && !scope.isBlank()) {
            form.append("&scope=").append(encode(scope));
        }
        String basic = Base64.getEncoder().encodeToString(
                (encode(clientId) + ":" + encode(clientSecret)).getBytes(StandardCharsets.UTF_8));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(tokenUri)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .header("Authorization", "Basic " + basic)
                .timeout(context.requestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(form.toString()))
                .build();

        HttpResponse<String> response;
        try {
            response = context.httpClient().send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("[OAuth2] Couldn't reach token endpoint {}: {}", tokenUri, e.getMessage());
            throw new TransportException(500, RENEW_FAILED, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(500, RENEW_FAILED, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.error("[OAuth2] Token endpoint {} returned HTTP {}: {}",
                    tokenUri, response.statusCode(), response.body());
            throw new TransportException(500, RENEW_FAILED);
        }

        JsonNode body;
        try {
            body = context.objectMapper().readTree(response.body());
        } catch (JsonProcessingException e) {
            log.error("[OAuth2] Unparsable token response: {}", e.getOriginalMessage());
            throw new TransportException(500, RENEW_FAILED, e);
        }

        JsonNode accessToken = body.path("access_token");
        JsonNode expiresIn   = body.path("expires_in");
        if (!accessToken.isTextual() || !(expiresIn.isNumber() || expiresIn.isTextual())) {
            log.error("[OAuth2] Token response without access_token/expires_in: fields={}",
                    body.isObject() ? fieldNames(body) : body.getNodeType());
            throw new TransportException(500, RENEW_FAILED);
        }

        long seconds = expiresIn.asLong(-1);
        if (seconds < 0) {
            log.error("[OAuth2] Token response with invalid expires_in: {}", expiresIn);
            throw new TransportException(500, RENEW_FAILED);
        }

        token  = accessToken.asText();
        expiry = context.clock().instant().plusSeconds(seconds);
        log.info("[OAuth2] Obtained token for client {} valid until {}", clientId, expiry);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String fieldNames(JsonNode node) {
        StringBuilder names = new StringBuilder();
        node.fieldNames().forEachRemaining(name -> {
            if (names.length() > 0) names.append(',');
            names.append(name);
        });
        return names.toString();
    }
}
