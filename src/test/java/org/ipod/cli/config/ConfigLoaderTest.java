package org.ipod.cli.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link ConfigLoader}: system properties override the file, the file overrides
 * {@code reference.conf}, and substitutions resolve across layers.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.priority");
        System.clearProperty("test.nested.setting");
        System.clearProperty("ipod.orchestration.chunkSize");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should layer the file over reference.conf")
    void loadFromFile_shouldLayerFileOverReference() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(25, config.getInt("ipod.orchestration.chunkSize"));
        assertEquals("sequential", config.getString("ipod.runtime.mode"));
        // untouched values come from reference.conf
        assertEquals(1, config.getInt("ipod.orchestration.maxWorkers"));
        assertEquals(10.0, config.getDouble("ipod.refinement.maxTolerance"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("ipod.orchestration.chunkSize", "7");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals(7, config.getInt("ipod.orchestration.chunkSize"));
    }

    @Test
    @DisplayName("Substitutions should resolve after all layers are stacked")
    void loadFromFile_shouldResolveReferencesAcrossLayers() {
        System.setProperty("test.priority", "system-override");
        System.setProperty("ipod.orchestration.chunkSize", "12");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
        assertEquals("system-override", config.getString("test.priority"));
        assertEquals(12, config.getInt("ipod.orchestration.maxWorkers"));
    }

    @Test
    @DisplayName("loadDefaults should expose every reference.conf block")
    void loadDefaults_shouldReturnReferenceConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertNotNull(config);
        for (String path : List.of("ipod.orchestration", "ipod.runtime", "ipod.index", "ipod.refinement",
                "ipod.routine", "ipod.logging")) {
            assertTrue(config.hasPath(path), "missing " + path);
        }
        assertEquals(10, config.getInt("ipod.orchestration.chunkSize"));
        assertEquals("auto", config.getString("ipod.runtime.mode"));
    }

    @Test
    @DisplayName("resolve should use an explicit file and report it")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertEquals(25, config.getInt("ipod.orchestration.chunkSize"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file from --config"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/ipod.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));

        assertTrue(e.getMessage().startsWith("Configuration file not found"));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
