package com.ifblock.adapter.spring;

import com.ifblock.block.CodeFenceExclusion;
import com.ifblock.block.ScanExclusion;
import com.ifblock.engine.ConditionalEngine;
import com.ifblock.engine.DefaultConditionalEngine;
import com.ifblock.evaluation.EvaluationOptions;
import com.ifblock.variable.VariableAccessor;
import com.ifblock.variable.VariableLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for the conditional engine.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "ifblock", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(IfBlockProperties.class)
public class IfBlockAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(IfBlockAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public EvaluationOptions ifBlockEvaluationOptions(IfBlockProperties properties) {
        EvaluationOptions options = properties.toOptions();
        log.info("Conditional evaluation options: {}", options);
        return options;
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionalEngine conditionalEngine(IfBlockProperties properties) {
        ScanExclusion exclusion = properties.isSkipCodeFences() ? new CodeFenceExclusion() : ScanExclusion.NONE;
        log.info("Creating ConditionalEngine (skipCodeFences={})", properties.isSkipCodeFences());
        return new DefaultConditionalEngine(exclusion);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "ifblock", name = "variables-path")
    public VariableAccessor ifBlockVariables(IfBlockProperties properties) {
        return VariableLoader.load(properties.getVariablesPath());
    }
}
