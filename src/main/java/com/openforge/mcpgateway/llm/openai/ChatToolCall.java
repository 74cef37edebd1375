package com.openforge.mcpgateway.llm.openai;

/**
 * A tool invocation in the OpenAI wire format.  function.arguments is a
 * JSON-encoded string, not an object.
 */
public record ChatToolCall(
        String       id,
        String       type,
        FunctionCall function
) {

    public static ChatToolCall ofFunction(String id, FunctionCall function) {
        return new ChatToolCall(id, "function", function);
    }
}
