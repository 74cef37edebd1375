package com.openforge.mcpgateway.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Author of a conversation message.  Serialized in lower case
 * ("system", "user", "assistant", "tool").
 */
public enum Role {

    SYSTEM,
    USER,
    ASSISTANT,
    TOOL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
