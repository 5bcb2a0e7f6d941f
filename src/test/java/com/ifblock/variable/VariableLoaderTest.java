package com.ifblock.variable;

import com.ifblock.exception.ConfigurationException;
import com.ifblock.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VariableLoader.
 */
class VariableLoaderTest {

    @Test
    @DisplayName("Should load JSON variables from the classpath")
    void loadJsonFromClasspath() {
        VariableAccessor accessor = VariableLoader.load("classpath:vars.json");

        assertEquals(Optional.of(Value.of("REPORT")), accessor.tryGet("role"));
        assertEquals(Optional.of(Value.of(3)), accessor.tryGet("RETRIES"));
        assertEquals(Optional.of(Value.of("QA-bot")), accessor.tryGet("agent.name"));
    }

    @Test
    @DisplayName("Should load YAML variables from the classpath")
    void loadYamlFromClasspath() {
        VariableAccessor accessor = VariableLoader.load("classpath:vars.yaml");

        assertEquals(Optional.of(Value.of("TEST")), accessor.tryGet("ROLE"));
        assertEquals(Optional.of(Value.FALSE), accessor.tryGet("verbose"));
    }

    @Test
    @DisplayName("Should load variables from the file system")
    void loadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("args.yml");
        Files.writeString(file, "mode: nightly\n");

        VariableAccessor accessor = VariableLoader.load(file.toString());

        assertEquals(Optional.of(Value.of("nightly")), accessor.tryGet("MODE"));
    }

    @Test
    @DisplayName("Should fail on unsupported, missing or empty paths")
    void failures(@TempDir Path dir) throws IOException {
        Path text = dir.resolve("vars.txt");
        Files.writeString(text, "a=b");

        assertThrows(ConfigurationException.class, () -> VariableLoader.load(text.toString()));
        assertThrows(ConfigurationException.class, () -> VariableLoader.load("classpath:does-not-exist.json"));
        assertThrows(ConfigurationException.class, () -> VariableLoader.load(" "));
    }
}
