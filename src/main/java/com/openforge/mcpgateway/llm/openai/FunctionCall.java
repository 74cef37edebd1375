package com.openforge.mcpgateway.llm.openai;

/**
 * The "function" sub-object of a tool call.
 *
 * Example:
 *   name      = "read_file"
 *   arguments = "{\"path\":\"/tmp/notes.txt\"}"
 */
public record FunctionCall(
        String name,
        String arguments
) {}
