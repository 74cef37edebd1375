package com.openforge.mcpgateway.llm.openai;

import java.util.List;

/**
 * Top-level response from /chat/completions.
 */
public record ChatResponse(
        String       id,
        String       model,
        List<Choice> choices,
        Usage        usage
) {

    public record Choice(
            int         index,
            ChatMessage message,
            String      finishReason
    ) {}

    public record Usage(
            long promptTokens,
            long completionTokens,
            long totalTokens
    ) {}
}
