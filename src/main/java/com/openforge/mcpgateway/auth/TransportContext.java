package com.openforge.mcpgateway.auth;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * The shared plumbing every {@link CredentialManager} is built on: one
 * HttpClient, one ObjectMapper, the per-call timeout and the clock used for
 * token expiry.
 */
public record TransportContext(
        HttpClient   httpClient,
        ObjectMapper objectMapper,
        Duration     requestTimeout,
        Clock        clock
) {}
