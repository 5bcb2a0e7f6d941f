package com.ifblock.spring;

import com.ifblock.adapter.spring.IfBlockAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the conditional engine in a Spring application that does not use
 * auto-configuration.
 *
 * Usage:
 * <pre>
 * &#64;Configuration
 * &#64;EnableIfBlock
 * public class TemplateConfig {
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(IfBlockAutoConfiguration.class)
public @interface EnableIfBlock {
}
