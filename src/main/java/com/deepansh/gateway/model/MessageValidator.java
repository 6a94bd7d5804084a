package com.deepansh.gateway.model;

import com.deepansh.gateway.exception.ConfigurationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a conversation before it is sent anywhere.
 */
public final class MessageValidator {

    private MessageValidator() {
    }

    public static void validate(Message message) {
        if (message == null || message.getRole() == null) {
            throw new ConfigurationException("Message role is required");
        }
        if (message.getRole() == Message.Role.tool
                && (message.getToolCallId() == null || message.getToolCallId().isBlank())) {
            throw new ConfigurationException("Tool message must carry a toolCallId");
        }
        if (message.hasToolCalls() && message.getRole() != Message.Role.assistant) {
            throw new ConfigurationException("Only assistant messages may carry tool calls, got "
                    + message.getRole());
        }
    }

    /**
     * Validates every message plus the cross-message invariant: a tool message
     * answers a tool call an earlier assistant message made.
     */
    public static void validateConversation(List<Message> conversation) {
        if (conversation == null || conversation.isEmpty()) {
            throw new ConfigurationException("Conversation must contain at least one message");
        }
        Set<String> issuedToolCallIds = new HashSet<>();
        for (Message message : conversation) {
            validate(message);
            if (message.hasToolCalls()) {
                message.getToolCalls().forEach(tc -> issuedToolCallIds.add(tc.getId()));
            }
            if (message.getRole() == Message.Role.tool && !issuedToolCallIds.contains(message.getToolCallId())) {
                throw new ConfigurationException("Tool message references unknown tool call id '"
                        + message.getToolCallId() + "'");
            }
        }
    }
}
