package com.deepansh.gateway.provider;

import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolNameMapping;
import com.deepansh.gateway.model.ToolResult;
import com.deepansh.gateway.streaming.NonStreamingParser;
import com.deepansh.gateway.streaming.StreamingParser;
import com.deepansh.gateway.tool.ToolDefinition;
import com.deepansh.gateway.tool.ToolNames;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Translation layer between the canonical model and one provider's wire format.
 * Stateless apart from configuration, and never performs network I/O.
 */
public interface ProviderAdapter {

    String getProviderId();

    /**
     * Converts the conversation into request body fields, e.g. {@code messages},
     * or {@code system} + {@code messages}, or {@code systemInstruction} + {@code contents}.
     */
    Map<String, Object> formatMessages(List<Message> messages);

    /** Provider tool entries. Provider-handled declarations become native entries or are dropped. */
    List<Map<String, Object>> formatTools(List<ToolDefinition> tools);

    /** Inverse of {@link #formatTools}: recovers canonical declarations. */
    List<ToolDefinition> parseTools(List<Map<String, Object>> formatted);

    ProviderRequest buildRequest(String model, List<Message> messages,
                                 List<ToolDefinition> tools, GenerationOptions options);

    StreamingParser createStreamingParser();

    NonStreamingParser createNonStreamingParser();

    /** The provider-native message (or content part) carrying one tool result. */
    Map<String, Object> formatToolResult(ToolResult result);

    /** Inverse of {@link #formatToolResult}, as the provider's inbound message. */
    Message parseToolResult(Map<String, Object> formatted);

    /**
     * Resolves a provider-produced function name to a declared tool.
     * Absorbs name normalization and the {@code x_x} name-doubling quirk; the
     * literal provider name is returned as the echo name.
     */
    default ToolNameMapping mapToolCallName(String rawName, Collection<String> declaredNames) {
        if (rawName == null || declaredNames.contains(rawName)) {
            return ToolNameMapping.identity(rawName);
        }
        for (String declared : declaredNames) {
            String normalized = ToolNames.normalize(declared);
            if (rawName.equals(normalized) || rawName.equals(normalized + "_" + normalized)
                    || rawName.equals(declared + "_" + declared)) {
                return new ToolNameMapping(declared, rawName);
            }
        }
        return ToolNameMapping.identity(rawName);
    }
}
