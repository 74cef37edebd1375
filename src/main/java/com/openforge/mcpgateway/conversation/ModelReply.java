package com.openforge.mcpgateway.conversation;

import java.util.List;

/** Ordered decisions of one model call plus the tokens it consumed. */
public record ModelReply(
        List<ModelDecision> decisions,
        UsageTokens         usage
) {

    public ModelReply {
        decisions = List.copyOf(decisions);
        usage = usage == null ? UsageTokens.ZERO : usage;
    }
}
