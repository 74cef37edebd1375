package com.openforge.mcpgateway.error;

import lombok.Getter;

/**
 * Root of every failure the gateway reports to its callers.  The status is
 * the HTTP status of the {@code {status, message}} body sent back; the
 * message is kept short and free of upstream detail.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final int status;

    public GatewayException(int status, String message) {
        super(message);
        this.status = status;
    }

    public GatewayException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
