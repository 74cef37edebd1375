package com.openforge.mcpgateway.llm.gemini;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Request body of Gemini's generateContent endpoint.
 *
 * Gemini speaks camelCase, so every type here overrides the shared
 * mapper's snake_case naming.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeminiRequest(
        List<Content>    contents,
        Content          systemInstruction,
        List<Tool>       tools,
        GenerationConfig generationConfig
) {

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Tool(List<FunctionDeclaration> functionDeclarations) {}

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record FunctionDeclaration(
            String     name,
            String     description,
            ObjectNode parameters
    ) {}

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GenerationConfig(
            Double  temperature,
            Integer maxOutputTokens,
            Double  topP
    ) {

        /** Null when the caller set no generation parameter at all. */
        static GenerationConfig of(Double temperature, Integer maxOutputTokens, Double topP) {
            if (temperature == null && maxOutputTokens == null && topP == null) {
                return null;
            }
            return new GenerationConfig(temperature, maxOutputTokens, topP);
        }
    }
}
