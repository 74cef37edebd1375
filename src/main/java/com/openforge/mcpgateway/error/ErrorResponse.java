package com.openforge.mcpgateway.error;

/** Body of every error answer: {@code {"status":404,"message":"Path not found"}}. */
public record ErrorResponse(
        int    status,
        String message
) {}
