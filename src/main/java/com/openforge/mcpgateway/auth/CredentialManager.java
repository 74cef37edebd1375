package com.openforge.mcpgateway.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.openforge.mcpgateway.error.ConfigurationException;
import com.openforge.mcpgateway.error.GatewayException;
import com.openforge.mcpgateway.error.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authenticated POST-JSON capability bound to one resolved endpoint URL.
 *
 * Built once per configured model from an {@link Auth} descriptor:
 *
 *   ApiKey/Header  → header added to every call
 *   ApiKey/Params  → query parameter baked into the resolved URL
 *   OAuth2         → bearer token from {@link OAuth2TokenSource}, refreshed on expiry
 *   None           → plain call
 *
 * Safe for concurrent use by any number of requests.
 */
@Slf4j
public class CredentialManager {

    private final TransportContext    context;
    private final URI                 uri;
    private final Map<String, String> headers;
    private final OAuth2TokenSource   tokenSource;

    private CredentialManager(TransportContext context, URI uri,
                              Map<String, String> headers, OAuth2TokenSource tokenSource) {
        this.context     = context;
        this.uri         = uri;
        this.headers     = Collections.unmodifiableMap(headers);
        this.tokenSource = tokenSource;
    }

    /**
     * Resolve the endpoint URL and bind the auth mode.
     *
     * @param extraHeaders provider-specific headers (may be null)
     * @param extraParams  provider-specific query parameters (may be null)
     * @throws ConfigurationException if a URL is invalid
     */
    public static CredentialManager create(TransportContext context,
                                           String baseUrl,
                                           Auth auth,
                                           Map<String, String> extraHeaders,
                                           Map<String, String> extraParams) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (extraHeaders != null) headers.putAll(extraHeaders);
        Map<String, String> params = new LinkedHashMap<>();
        if (extraParams != null) params.putAll(extraParams);

        OAuth2TokenSource tokenSource = null;
        if (auth instanceof Auth.ApiKey apiKey) {
            AuthLocation location = apiKey.location();
            if (location instanceof AuthLocation.Header) {
                headers.put(location.name(), location.value());
            } else {
                params.put(location.name(), location.value());
            }
        } else if (auth instanceof Auth.OAuth2 oauth) {
            tokenSource = new OAuth2TokenSource(context, parseUrl(oauth.tokenUrl(), Map.of()),
                    oauth.clientId(), oauth.clientSecret(), oauth.scope());
        }

        return new CredentialManager(context, parseUrl(baseUrl, params), headers, tokenSource);
    }

    /** The resolved endpoint, query parameters included. */
    public URI uri() {
        return uri;
    }

    /**
     * Serialize {@code body}, POST it to the bound URL and return the
     * response text.
     *
     * @throws TransportException on a non-2xx status (status carried over),
     *                            on network failure, or when an OAuth2 token
     *                            can't be renewed (500)
     */
    public String call(Object body) {
        String payload = serialize(body);
        log.debug("[Credential] → POST {} body={}", redact(uri), payload);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .header("Content-Type", "application/json")
                .timeout(context.requestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        headers.forEach(builder::header);
        if (tokenSource != null) {
            // Lock is held only inside currentToken(); the call below runs unlocked.
            builder.header("Authorization", "Bearer " + tokenSource.currentToken());
        }

        HttpResponse<String> response;
        try {
            response = context.httpClient().send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("Network error calling " + redact(uri), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(500, "Interrupted while calling " + redact(uri), e);
        }

        int    status = response.statusCode();
        String text   = response.body();
        log.debug("[Credential] ← HTTP {} body={}", status, text);

        if (status < 200 || status >= 300) {
            log.warn("[Credential] {} returned HTTP {}: {}", redact(uri), status, text);
            throw new TransportException(status, "Upstream returned HTTP " + status);
        }
        return text;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private String serialize(Object body) {
        try {
            return context.objectMapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new GatewayException(500, "Failed to serialize upstream request", e);
        }
    }

    static URI parseUrl(String url, Map<String, String> params) {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("Missing URL");
        }
        URI base;
        try {
            base = new URI(url);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid URL \"%s\"".formatted(url), e);
        }
        boolean web = "http".equalsIgnoreCase(base.getScheme()) || "https".equalsIgnoreCase(base.getScheme());
        if (!web || base.getHost() == null) {
            throw new ConfigurationException("Invalid URL \"%s\"".formatted(url));
        }
        if (params.isEmpty()) {
            return base;
        }

        StringBuilder query = new StringBuilder();
        if (base.getRawQuery() != null && !base.getRawQuery().isEmpty()) {
            query.append(base.getRawQuery());
        }
        params.forEach((name, value) -> {
            if (query.length() > 0) query.append('&');
            query.append(URLEncoder.encode(name, StandardCharsets.UTF_8))
                 .append('=')
                 .append(URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8));
        });

        String withoutQuery = url.contains("?") ? url.substring(0, url.indexOf('?')) : url;
        String fragment = base.getRawFragment() != null ? "#" + base.getRawFragment() : "";
        if (withoutQuery.contains("#")) {
            withoutQuery = withoutQuery.substring(0, withoutQuery.indexOf('#'));
        }
        return URI.create(withoutQuery + "?" + query + fragment);
    }

    /** Endpoint without its query string, which may hold an API key. */
    private static String redact(URI uri) {
        return uri.getScheme() + "://" + uri.getRawAuthority() + (uri.getRawPath() == null ? "" : uri.getRawPath());
    }
}
