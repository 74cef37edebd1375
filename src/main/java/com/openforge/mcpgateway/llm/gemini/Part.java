package com.openforge.mcpgateway.llm.gemini;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A content part.  Exactly one of the three fields is set; any other part
 * kind Gemini may send (inline data, code execution...) decodes with all
 * three null.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Part(
        String           text,
        FunctionCall     functionCall,
        FunctionResponse functionResponse
) {

    public static Part ofText(String text) {
        return new Part(text, null, null);
    }

    public static Part ofCall(String name, ObjectNode args) {
        return new Part(null, new FunctionCall(name, args), null);
    }

    public static Part ofResponse(String name, String content) {
        return new Part(null, null, new FunctionResponse(name, new FunctionContent(name, content)));
    }

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FunctionCall(String name, ObjectNode args) {}

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record FunctionResponse(String name, FunctionContent response) {}

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record FunctionContent(String name, String content) {}
}
