package com.ifblock.evaluation;

import com.ifblock.exception.ConditionalError;
import com.ifblock.exception.ConfigurationException;
import com.ifblock.exception.ErrorKind;
import com.ifblock.exception.UnknownVariableException;
import com.ifblock.expression.ConditionExpressionParser;
import com.ifblock.variable.VariableAccessor;
import com.ifblock.variable.VariableAccessorFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultExpressionEvaluator.
 */
class DefaultExpressionEvaluatorTest {

    private static final VariableAccessor VARIABLES = VariableAccessorFactory.fromMap(Map.of(
            "ROLE", "REPORT",
            "COUNT", 3,
            "FLAG", true,
            "NAME", "QA-Runner",
            "EMPTY", ""));

    private static boolean test(String expression, EvaluationOptions options) {
        return new DefaultExpressionEvaluator(VARIABLES, options)
                .test(ConditionExpressionParser.parse(expression), expression, 1);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiterString = "=>", value = {
            "ROLE == \"report\"                                 => true",
            "ROLE != \"TEST\"                                   => true",
            "ROLE == 3                                          => false",
            "ROLE != 3                                          => false",
            "COUNT == 3                                         => true",
            "COUNT == 3.0                                       => true",
            "COUNT == \"3\"                                     => false",
            "FLAG                                               => true",
            "FLAG == true                                       => true",
            "FLAG == \"true\"                                   => false",
            "!FLAG                                              => false",
            "EMPTY                                              => true",
            "UNDEFINED                                          => false",
            "!UNDEFINED                                         => true",
            "UNDEFINED == UNDEFINED                             => false",
            "UNDEFINED != \"x\"                                 => false",
            "NAME.StartsWith(\"qa\")                            => true",
            "NAME.EndsWith(\"RUNNER\")                          => true",
            "endsWith(NAME, \"QA\")                             => false",
            "contains(NAME, \"-r\")                             => true",
            "NAME.Contains(\"\")                                => true",
            "contains(COUNT, \"3\")                             => false",
            "contains(UNDEFINED, \"x\")                         => false",
            "in(ROLE, [\"TEST\", \"REPORT\"])                   => true",
            "in(ROLE, [])                                       => false",
            "in(COUNT, [1, 2, 3])                               => true",
            "in(COUNT, [\"3\"])                                 => false",
            "exists(ROLE)                                       => true",
            "exists(AGENT)                                      => false",
            "exists(AGENT) && AGENT.StartsWith(\"QA\")          => false",
            "ROLE == \"X\" || COUNT == 3 && FLAG                => true",
            "(ROLE == \"X\" || COUNT == 3) && !FLAG             => false",
            "\"TEST\" == \"test\"                               => true",
    })
    @DisplayName("Should evaluate with default options")
    void defaultOptions(String expression, boolean expected) {
        assertEquals(expected, test(expression, EvaluationOptions.defaults()));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiterString = "=>", value = {
            "\"TEST\" == \"test\"                   => false",
            "ROLE == \"REPORT\"                     => true",
            "ROLE != \"report\"                     => true",
            "NAME.StartsWith(\"qa\")                => false",
            "NAME.StartsWith(\"QA\")                => true",
            "contains(NAME, \"RUN\")                => false",
            "NAME.EndsWith(\"Runner\")              => true",
            "in(ROLE, [\"report\"])                 => false",
    })
    @DisplayName("Should compare strings exactly when case-sensitive")
    void caseSensitive(String expression, boolean expected) {
        assertEquals(expected, test(expression, EvaluationOptions.defaults().withCaseSensitiveStrings(true)));
    }

    @Test
    @DisplayName("Strict mode should fail on an unknown variable, naming it")
    void strictUnknownVariable() {
        EvaluationOptions strict = EvaluationOptions.defaults().withStrict(true);

        UnknownVariableException ex = assertThrows(UnknownVariableException.class,
                () -> test("AGENT == 'QA'", strict));

        ConditionalError error = ex.getError();
        assertEquals(ErrorKind.UNKNOWN_VARIABLE_STRICT, error.kind());
        assertEquals("AGENT", error.variable());
        assertEquals("AGENT == 'QA'", error.expression());
        assertEquals(1, error.line());
    }

    @Test
    @DisplayName("Strict mode should not fail on exists() or short-circuited operands")
    void strictSkipsUnevaluated() {
        EvaluationOptions strict = EvaluationOptions.defaults().withStrict(true);

        assertFalse(test("exists(AGENT)", strict));
        assertFalse(test("exists(AGENT) && AGENT == 'QA'", strict));
        assertTrue(test("FLAG || AGENT == 'QA'", strict));
    }

    @Test
    @DisplayName("Lenient mode treats unknown variables as missing")
    void lenientUnknownVariable() {
        assertFalse(test("AGENT == 'QA'", EvaluationOptions.defaults()));
        assertTrue(test("AGENT != 'QA' || true", EvaluationOptions.defaults()));
    }

    @Test
    @DisplayName("Should reject a nesting limit below one")
    void invalidOptions() {
        assertThrows(ConfigurationException.class, () -> EvaluationOptions.defaults().withMaxNesting(0));
        assertEquals(EvaluationOptions.DEFAULT_MAX_NESTING, EvaluationOptions.defaults().maxNesting());
    }

    @Test
    @DisplayName("Case-insensitive functions fold characters the same way as ==")
    void consistentCaseFolding() {
        DefaultExpressionEvaluator evaluator = new DefaultExpressionEvaluator(
                VariableAccessorFactory.fromMap(Map.of("CITY", "\u0130stanbul")), EvaluationOptions.defaults());

        for (String expression : new String[]{
                "CITY == \"istanbul\"",
                "contains(CITY, \"istan\")",
                "CITY.StartsWith(\"ist\")",
                "CITY.Contains(\"BUL\")"}) {
            assertTrue(evaluator.test(ConditionExpressionParser.parse(expression), expression, 1), expression);
        }
    }
}
