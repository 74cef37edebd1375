package com.openforge.mcpgateway.llm;

import com.openforge.mcpgateway.conversation.Conversation;
import com.openforge.mcpgateway.conversation.ModelReply;
import com.openforge.mcpgateway.conversation.ToolSpec;

import java.util.List;

/**
 * One upstream model, reached through its provider's own wire format.
 *
 * Implementations translate the canonical conversation and tool catalog
 * into a provider request and the provider's answer back into ordered
 * {@link com.openforge.mcpgateway.conversation.ModelDecision}s.  A single
 * instance serves every request of every workspace that references it.
 */
public interface ModelAdapter {

    /** Configured model name, for logs. */
    String name();

    /**
     * @throws com.openforge.mcpgateway.error.TransportException if the provider can't be reached
     *                                                          or answers with a non-2xx status
     * @throws com.openforge.mcpgateway.error.ProtocolException  if the answer has an unexpected shape
     */
    ModelReply call(Conversation conversation, List<ToolSpec> tools);
}
