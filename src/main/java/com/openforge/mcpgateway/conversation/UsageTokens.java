package com.openforge.mcpgateway.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token counters in the gateway's own naming; every adapter maps its
 * provider's counters onto these three.
 */
public record UsageTokens(
        @JsonProperty("completion_tokens") long completionTokens,
        @JsonProperty("prompt_tokens")     long promptTokens,
        @JsonProperty("total_tokens")      long totalTokens
) {

    public static final UsageTokens ZERO = new UsageTokens(0, 0, 0);

    public UsageTokens plus(UsageTokens other) {
        if (other == null) return this;
        return new UsageTokens(
                completionTokens + other.completionTokens,
                promptTokens + other.promptTokens,
                totalTokens + other.totalTokens);
    }
}
