package com.openforge.mcpgateway.auth;

/** Where a static API key travels: a request header or a query parameter. */
public sealed interface AuthLocation permits AuthLocation.Header, AuthLocation.Params {

    String name();

    String value();

    record Header(String name, String value) implements AuthLocation {}

    record Params(String name, String value) implements AuthLocation {}
}
