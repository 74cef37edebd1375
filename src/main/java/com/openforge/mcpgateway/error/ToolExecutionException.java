package com.openforge.mcpgateway.error;

/** A resolved tool could not be listed or invoked. */
public class ToolExecutionException extends GatewayException {

    public ToolExecutionException(String message, Throwable cause) {
        super(500, message, cause);
    }
}
