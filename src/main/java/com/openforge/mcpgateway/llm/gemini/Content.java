package com.openforge.mcpgateway.llm.gemini;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * One entry of "contents" (or the system instruction).
 *
 * role variants:
 *   "user"       human turn
 *   "model"      assistant turn, text or functionCall parts
 *   "function"   functionResponse parts not attached to a model entry
 *
 * The system instruction carries no role.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Content(
        String     role,
        List<Part> parts
) {

    public static final String ROLE_USER     = "user";
    public static final String ROLE_MODEL    = "model";
    public static final String ROLE_FUNCTION = "function";
}
