package com.openforge.mcpgateway.llm.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * A single entry of the OpenAI "messages" array.
 *
 * role variants:
 *   "system"      initial persona / instructions
 *   "user"        human turn
 *   "assistant"   model reply; may contain tool_calls instead of content
 *   "tool"        result returned after executing a tool call
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
        String role,

        /** Text content. Null for assistant messages that only contain tool_calls. */
        String content,

        List<ChatToolCall> toolCalls,

        /** Present only in tool-result messages; matches the id of a ChatToolCall. */
        String toolCallId
) {}
