package com.ifblock.adapter.spring;

import com.ifblock.engine.ConditionalEngine;
import com.ifblock.evaluation.EvaluationOptions;
import com.ifblock.spring.EnableIfBlock;
import com.ifblock.value.Value;
import com.ifblock.variable.VariableAccessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IfBlockAutoConfiguration.
 */
class IfBlockAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(IfBlockAutoConfiguration.class));

    @Test
    @DisplayName("Should register the engine with default options")
    void defaults() {
        contextRunner.run(context -> {
            assertEquals(1, context.getBeansOfType(ConditionalEngine.class).size());
            assertEquals(EvaluationOptions.defaults(), context.getBean(EvaluationOptions.class));
            assertTrue(context.getBeansOfType(VariableAccessor.class).isEmpty());
        });
    }

    @Test
    @DisplayName("Should bind evaluation options from properties")
    void boundOptions() {
        contextRunner
                .withPropertyValues("ifblock.strict=true", "ifblock.case-sensitive-strings=true",
                        "ifblock.max-nesting=3")
                .run(context -> assertEquals(new EvaluationOptions(true, true, 3),
                        context.getBean(EvaluationOptions.class)));
    }

    @Test
    @DisplayName("Should back off when disabled")
    void disabled() {
        contextRunner
                .withPropertyValues("ifblock.enabled=false")
                .run(context -> {
                    assertTrue(context.getBeansOfType(ConditionalEngine.class).isEmpty());
                    assertTrue(context.getBeansOfType(EvaluationOptions.class).isEmpty());
                });
    }

    @Test
    @DisplayName("Should load a variable store when a path is configured")
    void variables() {
        contextRunner
                .withPropertyValues("ifblock.variables-path=classpath:vars.json")
                .run(context -> {
                    VariableAccessor accessor = context.getBean(VariableAccessor.class);
                    assertEquals(Optional.of(Value.of("REPORT")), accessor.tryGet("ROLE"));

                    ConditionalEngine engine = context.getBean(ConditionalEngine.class);
                    assertEquals("report", engine.evaluate(
                            "{{#if ROLE == 'report'}}report{{else}}other{{/if}}",
                            accessor, context.getBean(EvaluationOptions.class)).getValue());
                });
    }

    @Test
    @DisplayName("Should leave fenced markers alone when code fences are skipped")
    void skipCodeFences() {
        String template = "```\n{{#if X}}kept{{/if}}\n```\n";

        contextRunner
                .withPropertyValues("ifblock.skip-code-fences=true")
                .run(context -> assertEquals(template, context.getBean(ConditionalEngine.class)
                        .evaluate(template, VariableAccessor.empty()).getValue()));
    }

    @Test
    @DisplayName("Should register the engine through @EnableIfBlock")
    void enableAnnotation() {
        new ApplicationContextRunner()
                .withUserConfiguration(EnabledConfig.class)
                .run(context -> {
                    assertNotNull(context.getBean(ConditionalEngine.class));
                    assertNotNull(context.getBean(IfBlockProperties.class));
                });
    }

    @Configuration
    @EnableIfBlock
    static class EnabledConfig {
    }
}
