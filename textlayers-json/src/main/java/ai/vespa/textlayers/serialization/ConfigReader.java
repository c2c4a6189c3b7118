// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.serialization;

import ai.vespa.textlayers.resolve.ConflictResolverConfig;
import ai.vespa.textlayers.resolve.Strategy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads conflict resolver configs from JSON documents such as
 * {"strategy": "MIN", "priority_attribute": "_priority_", "keep_equal": false}.
 * Keys left out keep their default value.
 */
public final class ConfigReader {

    private ConfigReader() {}

    /**
     * Reads a config from a JSON string.
     *
     * @throws IllegalArgumentException if the JSON is invalid, or has unknown keys or invalid values
     */
    public static ConflictResolverConfig readConflictResolverConfig(String json) {
        JsonNode root;
        try {
            root = Jackson.mapper().readTree(json);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || ! root.isObject())
            throw new IllegalArgumentException("A conflict resolver config must be a JSON object");

        ConflictResolverConfig.Builder builder = ConflictResolverConfig.defaults().toBuilder();
        for (Iterator<Map.Entry<String, JsonNode>> i = root.fields(); i.hasNext(); ) {
            Map.Entry<String, JsonNode> field = i.next();
            JsonNode value = field.getValue();
            switch (field.getKey()) {
                case "strategy":
                    builder.strategy(Strategy.fromName(requireText(field.getKey(), value)));
                    break;
                case "priority_attribute":
                    builder.priorityAttribute(requireText(field.getKey(), value));
                    break;
                case "keep_equal":
                    if ( ! value.isBoolean())
                        throw new IllegalArgumentException("'keep_equal' must be a boolean, got " + value);
                    builder.keepEqual(value.asBoolean());
                    break;
                default:
                    throw new IllegalArgumentException("Unknown conflict resolver config key '" + field.getKey() + "'");
            }
        }
        return builder.build();
    }

    /** Reads a config from a file */
    public static ConflictResolverConfig readConflictResolverConfig(Path file) {
        try {
            return readConflictResolverConfig(Files.readString(file, UTF_8));
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
    }

    /** Reads a config from a class path resource */
    public static ConflictResolverConfig readConflictResolverConfigResource(String resource) {
        try (InputStream in = ConfigReader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("No resource '" + resource + "' on the class path");
            return readConflictResolverConfig(new String(in.readAllBytes(), UTF_8));
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not read resource " + resource, e);
        }
    }

    private static String requireText(String key, JsonNode value) {
        if ( ! value.isTextual())
            throw new IllegalArgumentException("'" + key + "' must be a string, got " + value);
        return value.asText();
    }

}
