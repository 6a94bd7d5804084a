package com.deepansh.gateway.tool;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Canonical tool declaration exposed to the model.
 * Decouples each provider's serialization format from the handler behind it.
 *
 * A declaration with an empty schema and {@code providerHandled = true} stands
 * for a provider-native capability (e.g. built-in search) rather than a
 * dispatchable tool.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;

    @Builder.Default
    private Map<String, Object> parametersSchema = Map.of("type", "object", "properties", Map.of());

    private boolean providerHandled;

    public static ToolDefinition from(GatewayTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .parametersSchema(tool.getInputSchema())
                .build();
    }

    public static ToolDefinition providerNative(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .parametersSchema(Map.of())
                .providerHandled(true)
                .build();
    }
}
