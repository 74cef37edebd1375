package com.openforge.mcpgateway.error;

import lombok.Getter;

/**
 * Talking to an upstream provider failed: non-2xx answer (status carried
 * over) or no answer at all (500, {@link #isNetworkFailure()} set).
 */
@Getter
public class TransportException extends GatewayException {

    private final boolean networkFailure;

    public TransportException(int status, String message) {
        super(status, message);
        this.networkFailure = false;
    }

    public TransportException(String message, Throwable cause) {
        super(500, message, cause);
        this.networkFailure = true;
    }

    public TransportException(int status, String message, Throwable cause) {
        super(status, message, cause);
        this.networkFailure = false;
    }
}
