package com.openforge.mcpgateway.conversation;

import java.util.List;

/**
 * What the model decided to do in one step of its reply.  A single provider
 * response may interleave several of these.
 */
public sealed interface ModelDecision permits ModelDecision.TextMessage, ModelDecision.ToolCalls {

    record TextMessage(String text) implements ModelDecision {}

    record ToolCalls(List<ToolCall> calls) implements ModelDecision {

        public ToolCalls {
            calls = List.copyOf(calls);
        }
    }
}
