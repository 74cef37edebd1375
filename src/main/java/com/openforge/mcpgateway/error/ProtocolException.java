package com.openforge.mcpgateway.error;

/**
 * An upstream answer that does not have the expected shape: unparsable
 * body, unknown finish reason, undecodable tool arguments, a tool result
 * that is not a single text item.
 */
public class ProtocolException extends GatewayException {

    public ProtocolException(String message) {
        super(500, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(500, message, cause);
    }
}
