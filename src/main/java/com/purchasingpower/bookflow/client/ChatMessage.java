package com.purchasingpower.bookflow.client;

import lombok.Value;

/**
 * One role-tagged message sent to a generative provider.
 */
@Value
public class ChatMessage {

    String role;
    String content;

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }
}
