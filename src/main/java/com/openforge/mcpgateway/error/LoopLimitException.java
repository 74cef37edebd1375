package com.openforge.mcpgateway.error;

/** The agent loop ran out of iterations or time. */
public class LoopLimitException extends GatewayException {

    private LoopLimitException(int status, String message) {
        super(status, message);
    }

    public static LoopLimitException iterations(int maxIterations) {
        return new LoopLimitException(500,
                "Maximum tool-calling iterations reached (%d)".formatted(maxIterations));
    }

    public static LoopLimitException timeout() {
        return new LoopLimitException(504, "Request timed out");
    }
}
