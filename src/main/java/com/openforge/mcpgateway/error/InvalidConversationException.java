package com.openforge.mcpgateway.error;

/** The caller sent a conversation the gateway cannot forward. */
public class InvalidConversationException extends GatewayException {

    public InvalidConversationException(String message) {
        super(400, message);
    }
}
