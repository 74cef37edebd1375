package com.openforge.mcpgateway.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request and response body of a workspace endpoint.
 *
 * The caller sends the full history on every request; the agent loop only
 * ever appends to it.  {@code tools} is the caller's own tool list in the
 * OpenAI function shape and is echoed back untouched.  {@code usage} is
 * filled in on the way out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"messages", "temperature", "max_tokens", "top_p", "tools", "usage"})
public final class Conversation {

    private final List<Message>  messages;
    private final Double         temperature;
    private final Integer        maxTokens;
    private final Double         topP;
    private final List<JsonNode> tools;
    private UsageTokens          usage;

    @JsonCreator
    public Conversation(@JsonProperty("messages")    List<Message>  messages,
                        @JsonProperty("temperature") Double         temperature,
                        @JsonProperty("max_tokens")  Integer        maxTokens,
                        @JsonProperty("top_p")       Double         topP,
                        @JsonProperty("tools")       List<JsonNode> tools) {
        this.messages    = messages == null ? new ArrayList<>() : new ArrayList<>(messages);
        this.temperature = temperature;
        this.maxTokens   = maxTokens;
        this.topP        = topP;
        this.tools       = tools == null ? null : List.copyOf(tools);
    }

    public static Conversation of(List<Message> messages) {
        return new Conversation(messages, null, null, null, null);
    }

    /** Independent copy sharing no mutable state with this one. */
    public Conversation copy() {
        Conversation copy = new Conversation(messages, temperature, maxTokens, topP, tools);
        copy.usage = usage;
        return copy;
    }

    public void append(Message message) {
        messages.add(message);
    }

    @JsonProperty("messages")
    public List<Message> messages() {
        return Collections.unmodifiableList(messages);
    }

    @JsonIgnore
    public Message lastMessage() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    @JsonProperty("temperature")
    public Double temperature() {
        return temperature;
    }

    @JsonProperty("max_tokens")
    public Integer maxTokens() {
        return maxTokens;
    }

    @JsonProperty("top_p")
    public Double topP() {
        return topP;
    }

    @JsonProperty("tools")
    public List<JsonNode> tools() {
        return tools;
    }

    @JsonProperty("usage")
    public UsageTokens usage() {
        return usage;
    }

    public void setUsage(UsageTokens usage) {
        this.usage = usage;
    }
}
