package com.purchasingpower.bookflow.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for the chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    /**
     * The user's message.
     */
    private String message;

    /**
     * Store user the message is executed for. Identity is not verified here.
     */
    private Long userId;

    /**
     * Optional chat session, only recorded in the audit log.
     */
    private Long sessionId;
}
