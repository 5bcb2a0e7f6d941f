package com.ifblock.adapter.spring;

import com.ifblock.evaluation.EvaluationOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the conditional engine.
 */
@ConfigurationProperties(prefix = "ifblock")
public class IfBlockProperties {

    /**
     * Whether the engine beans are registered.
     */
    private boolean enabled = true;

    /**
     * Unknown variables fail evaluation instead of evaluating as missing.
     */
    private boolean strict = false;

    /**
     * Compare strings case-sensitively.
     */
    private boolean caseSensitiveStrings = false;

    /**
     * Maximum depth of nested blocks.
     */
    private int maxNesting = EvaluationOptions.DEFAULT_MAX_NESTING;

    /**
     * Leave markers inside fenced code blocks as literal text.
     */
    private boolean skipCodeFences = false;

    /**
     * Optional JSON or YAML file of variables to expose as a VariableAccessor bean.
     * Supports classpath: prefix for classpath resources.
     */
    private String variablesPath;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public boolean isCaseSensitiveStrings() {
        return caseSensitiveStrings;
    }

    public void setCaseSensitiveStrings(boolean caseSensitiveStrings) {
        this.caseSensitiveStrings = caseSensitiveStrings;
    }

    public int getMaxNesting() {
        return maxNesting;
    }

    public void setMaxNesting(int maxNesting) {
        this.maxNesting = maxNesting;
    }

    public boolean isSkipCodeFences() {
        return skipCodeFences;
    }

    public void setSkipCodeFences(boolean skipCodeFences) {
        this.skipCodeFences = skipCodeFences;
    }

    public String getVariablesPath() {
        return variablesPath;
    }

    public void setVariablesPath(String variablesPath) {
        this.variablesPath = variablesPath;
    }

    /**
     * Evaluation options described by these properties.
     */
    public EvaluationOptions toOptions() {
        return new EvaluationOptions(strict, caseSensitiveStrings, maxNesting);
    }
}
