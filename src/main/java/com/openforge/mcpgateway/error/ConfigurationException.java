package com.openforge.mcpgateway.error;

/**
 * Invalid gateway configuration: undefined model or MCP reference, bad path
 * or URL, an auth mode a provider cannot use.  Raised while the application
 * context starts, which aborts startup.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(500, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(500, message, cause);
    }
}
