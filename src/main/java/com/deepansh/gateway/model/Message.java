package com.deepansh.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    /** Metadata key marking a tool message whose call failed. */
    public static final String TOOL_ERROR = "toolError";

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;

    /** Plain-text content. Ignored by adapters when {@link #parts} is non-empty. */
    private String content;

    /** Ordered typed parts for multi-part content (text, images, tool references). */
    private List<ContentPart> parts;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the dispatch name of the tool that produced this result */
    private String name;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Replayed verbatim on the next request so the provider can correlate results.
     */
    private List<ToolCall> toolCalls;

    /** Provider quirks needed to re-serialize this message, e.g. {@code echoName}. */
    private Map<String, Object> providerMetadata;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(Role.assistant)
                .content(content)
                .toolCalls(List.copyOf(toolCalls))
                .build();
    }

    /**
     * Builds the tool message for a result. {@code serializedContent} is the
     * JSON (or plain text) the model will read.
     */
    public static Message toolResult(ToolResult result, String serializedContent) {
        Map<String, Object> metadata = new HashMap<>();
        if (result.getEchoName() != null) {
            metadata.put(ToolCall.ECHO_NAME, result.getEchoName());
        }
        if (result.getError() != null) {
            metadata.put(TOOL_ERROR, true);
        }
        return Message.builder()
                .role(Role.tool)
                .toolCallId(result.getToolCallId())
                .name(result.getName())
                .content(serializedContent)
                .providerMetadata(metadata.isEmpty() ? null : Map.copyOf(metadata))
                .build();
    }

    /** True for a tool message built from a failed tool call. */
    public boolean isToolError() {
        return providerMetadata != null && Boolean.TRUE.equals(providerMetadata.get(TOOL_ERROR));
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasParts() {
        return parts != null && !parts.isEmpty();
    }

    /** Concatenated text of this message, whichever form it was given in. */
    public String getTextContent() {
        if (!hasParts()) {
            return content;
        }
        return parts.stream()
                .filter(p -> p.getType() == ContentPart.Type.TEXT)
                .map(ContentPart::getText)
                .collect(Collectors.joining());
    }

    public String getEchoName() {
        if (providerMetadata != null && providerMetadata.get(ToolCall.ECHO_NAME) instanceof String echo) {
            return echo;
        }
        return name;
    }
}
