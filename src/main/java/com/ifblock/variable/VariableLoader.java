package com.ifblock.variable;

import com.ifblock.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Loads a variable store from a JSON or YAML file.
 * The format is chosen by file extension; .json is JSON, .yaml and .yml are YAML.
 */
public class VariableLoader {

    private static final Logger log = LoggerFactory.getLogger(VariableLoader.class);

    /**
     * Load variables from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the variables file
     * @return Accessor over the loaded variables
     */
    public static VariableAccessor load(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("Variables path cannot be empty");
        }
        log.info("Loading variables from: {}", path);

        Resource resource = getResource(path);
        String text;
        try (InputStream inputStream = resource.getInputStream()) {
            text = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load variables from: " + path, e);
        }

        Map<String, Object> variables = parse(path, text);
        log.info("Loaded {} variables from {}", variables.size(), path);
        return new MapVariableAccessor(variables);
    }

    private static Map<String, Object> parse(String path, String text) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) {
            return text.isBlank() ? Map.of() : VariableAccessorFactory.parseJson(text);
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return VariableAccessorFactory.parseYaml(text);
        }
        throw new ConfigurationException("Unsupported variables file type: " + path
                + ". Expected .json, .yaml or .yml");
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }
}
