package com.deepansh.gateway.tool;

import com.deepansh.gateway.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry(3);
    }

    @Test
    void register_duplicateName_rejected() {
        registry.register(ToolDefinition.builder().name("lookup").build(), (args, ctx) -> "a");

        assertThatThrownBy(() -> registry.register(ToolDefinition.builder().name("lookup").build(), (args, ctx) -> "b"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void register_malformedSchema_rejected() {
        ToolDefinition bad = ToolDefinition.builder()
                .name("bad")
                .parametersSchema(Map.of("type", "object", "properties", Map.of("x", Map.of("type", "text"))))
                .build();

        assertThatThrownBy(() -> registry.register(bad, (args, ctx) -> null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("$.x");
    }

    @Test
    void register_invalidName_rejected() {
        assertThatThrownBy(() -> registry.register(ToolDefinition.builder().name("has space").build(), (args, ctx) -> null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void register_missingHandler_rejected() {
        assertThatThrownBy(() -> registry.register(ToolDefinition.builder().name("x").build(), null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("no handler");
    }

    @Test
    void register_defaultConcurrencyLimitApplied() {
        registry.register(ToolDefinition.builder().name("a").build(), (args, ctx) -> null);
        registry.register(ToolDefinition.builder().name("b").build(), (args, ctx) -> null, 1);

        assertThat(registry.find("a")).get().extracting(RegisteredTool::getConcurrencyLimit).isEqualTo(3);
        assertThat(registry.find("b")).get().extracting(RegisteredTool::getConcurrencyLimit).isEqualTo(1);
    }

    @Test
    void constructor_registersToolBeans() {
        GatewayTool bean = new GatewayTool() {
            @Override
            public String getName() {
                return "current_time";
            }

            @Override
            public String getDescription() {
                return "Returns the current time";
            }

            @Override
            public Map<String, Object> getInputSchema() {
                return Map.of("type", "object", "properties", Map.of());
            }

            @Override
            public Object execute(Map<String, Object> arguments, ToolContext context) {
                return "12:00";
            }
        };

        ToolRegistry fromBeans = new ToolRegistry(List.of(bean), 2);

        assertThat(fromBeans.hasTool("current_time")).isTrue();
        assertThat(fromBeans.getAllDefinitions()).extracting(ToolDefinition::getDescription)
                .containsExactly("Returns the current time");
    }

    @Test
    void getDefinitions_keepsRequestedOrderAndSkipsUnknown() {
        registry.register(ToolDefinition.builder().name("a").build(), (args, ctx) -> null);
        registry.register(ToolDefinition.builder().name("b").build(), (args, ctx) -> null);

        assertThat(registry.getDefinitions(List.of("b", "nope", "a")))
                .extracting(ToolDefinition::getName).containsExactly("b", "a");
    }

    @Test
    void constructor_nonPositiveDefaultLimit_rejected() {
        assertThatThrownBy(() -> new ToolRegistry(0)).isInstanceOf(ConfigurationException.class);
    }
}
