package org.turingsim.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader}: layer precedence and config file discovery.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final List<String> messages = new ArrayList<>();
    private final ConfigLoader.ConfigMessageHandler handler = (level, message) -> messages.add(level + " " + message);

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("cli.print-padding");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should merge the file over classpath defaults")
    void loadFromFile_shouldMergeFileOverDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(4, config.getInt("cli.print-padding"));
        assertEquals(Duration.ofMillis(5), config.getDuration("cli.sleep-delay"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("cli.print-padding", "7");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals(7, config.getInt("cli.print-padding"));
    }

    @Test
    @DisplayName("loadDefaults should expose the reference values")
    void loadDefaults_shouldExposeReferenceValues() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(15, config.getInt("cli.print-padding"));
        assertEquals(Duration.ofMillis(100), config.getDuration("cli.sleep-delay"));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("resolve should use an explicit config file and report it")
    void resolve_explicitFile() throws Exception {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "cli.print-padding = 3\n");

        Config config = ConfigLoader.resolve(file.toFile(), handler);

        assertEquals(3, config.getInt("cli.print-padding"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit config file")
    void resolve_missingExplicitFile() {
        File missing = tempDir.resolve("missing.conf").toFile();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ConfigLoader.resolve(missing, handler));

        assertTrue(e.getMessage().contains("missing.conf"));
    }

    @Test
    @DisplayName("resolve should honour -Dconfig.file")
    void resolve_systemPropertyConfigFile() throws Exception {
        Path file = tempDir.resolve("system.conf");
        Files.writeString(file, "cli.print-padding = 9\n");
        System.setProperty("config.file", file.toString());
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.resolve(null, handler);

        assertEquals(9, config.getInt("cli.print-padding"));
        assertTrue(messages.get(0).contains("-Dconfig.file"));
    }

    @Test
    @DisplayName("resolve should reject a missing -Dconfig.file")
    void resolve_missingSystemPropertyConfigFile() {
        System.setProperty("config.file", tempDir.resolve("nope.conf").toString());

        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.resolve(null, handler));
    }

    @Test
    @DisplayName("resolve should fall back to classpath defaults")
    void resolve_fallsBackToDefaults() {
        Config config = ConfigLoader.resolve(null, handler);

        assertEquals(15, config.getInt("cli.print-padding"));
        assertTrue(messages.get(0).contains("using defaults from classpath"));
    }

    private static File testResource(String name) {
        URL url = ConfigLoaderTest.class.getClassLoader().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
