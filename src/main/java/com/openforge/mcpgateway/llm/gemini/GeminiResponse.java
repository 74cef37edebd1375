package com.openforge.mcpgateway.llm.gemini;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Response of generateContent.  Gemini answers in camelCase; the
 * snake_case spellings some proxies emit are accepted as aliases.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record GeminiResponse(
        List<Candidate> candidates,
        @JsonAlias("usage_metadata") UsageMetadata usageMetadata
) {

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record Candidate(
            Content content,
            @JsonAlias("finish_reason") String finishReason
    ) {}

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record UsageMetadata(
            @JsonAlias("prompt_token_count")     long promptTokenCount,
            @JsonAlias("candidates_token_count") long candidatesTokenCount,
            @JsonAlias("total_token_count")      long totalTokenCount
    ) {}
}
