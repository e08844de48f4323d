package ch.so.arp.assistant.chat;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Author of a chat message as understood by OpenAI compatible endpoints.
 */
public enum ChatRole {

    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant");

    private final String wireValue;

    ChatRole(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
