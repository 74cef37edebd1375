package com.openforge.mcpgateway.auth;

/**
 * How a model endpoint authenticates the gateway.
 *
 *   ApiKey    static secret baked into every call (header or query parameter)
 *   OAuth2    client-credentials grant, bearer token cached until expiry
 *   None      plain calls
 */
public sealed interface Auth permits Auth.ApiKey, Auth.OAuth2, Auth.None {

    record ApiKey(AuthLocation location) implements Auth {}

    record OAuth2(
            String tokenUrl,
            String clientId,
            String clientSecret,
            String scope
    ) implements Auth {}

    record None() implements Auth {}

    static Auth none() {
        return new None();
    }
}
