package com.openforge.mcpgateway.llm.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * model is left null for Azure deployments, where the deployment in the URL
 * selects the model.  tools and toolChoice are left null when the workspace
 * has no tools; some providers reject an empty tools array.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String            model,
        List<ChatMessage> messages,
        Double            temperature,
        Integer           maxTokens,
        Double            topP,
        List<Tool>        tools,
        String            toolChoice
) {}
