// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.serialization;

import ai.vespa.textlayers.resolve.ConflictResolverConfig;
import ai.vespa.textlayers.resolve.Strategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConfigReaderTestCase {

    @TempDir
    Path tempDir;

    @Test
    void requireThatConfigIsReadFromResources() {
        ConflictResolverConfig config = ConfigReader.readConflictResolverConfigResource("resolver-config.json");
        assertEquals(Strategy.MIN, config.strategy());
        assertEquals("rank", config.priorityAttribute());
        assertFalse(config.keepEqual());
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConflictResolverConfigResource("missing.json"));
    }

    @Test
    void requireThatOmittedKeysKeepTheirDefaults() throws Exception {
        assertEquals(ConflictResolverConfig.defaults(), ConfigReader.readConflictResolverConfig("{}"));
        ConflictResolverConfig config = ConfigReader.readConflictResolverConfig("{\"strategy\": \"all\"}");
        assertEquals(ConflictResolverConfig.defaults().toBuilder().strategy(Strategy.ALL).build(), config);

        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"keep_equal\": false}");
        assertEquals(ConflictResolverConfig.defaults().toBuilder().keepEqual(false).build(),
                     ConfigReader.readConflictResolverConfig(file));
    }

    @Test
    void requireThatInvalidConfigIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConflictResolverConfig("[]"));
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConflictResolverConfig("{"));
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConflictResolverConfig("{\"strategy\": \"SOME\"}"));
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConflictResolverConfig("{\"strategy\": 1}"));
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConflictResolverConfig("{\"keep_equal\": \"yes\"}"));
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConflictResolverConfig("{\"priority_attribute\": \"\"}"));
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConflictResolverConfig("{\"priority\": \"rank\"}"));
    }

}
