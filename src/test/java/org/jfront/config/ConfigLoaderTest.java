package org.jfront.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ConfigLoader} and its precedence rules.
 */
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    /**
     * Without a file or overrides, the values of {@code reference.conf} apply.
     */
    @Test
    @Tag("unit")
    void testDefaultsFromReferenceConfiguration() {
        // Act
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile(), Map.of());

        // Assert
        assertThat(config.getBoolean("jfront.lexer.ignore-errors")).isFalse();
        assertThat(config.getBoolean("jfront.parser.debug")).isFalse();
        assertThat(config.getString("logging.default-level")).isEqualTo("INFO");
    }

    /**
     * Environment variables override the configuration file, which overrides the defaults.
     */
    @Test
    @Tag("unit")
    void testPrecedence() throws IOException {
        // Arrange
        Path file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, "jfront { lexer { ignore-errors = true }, parser { debug = true } }");
        Map<String, String> environment = Map.of("JFRONT_LEXER_IGNORE__ERRORS", "false");

        // Act
        Config config = ConfigLoader.load(file.toFile(), environment);

        // Assert
        assertThat(config.getBoolean("jfront.lexer.ignore-errors")).isFalse();
        assertThat(config.getBoolean("jfront.parser.debug")).isTrue();
        assertThat(config.getString("logging.default-level")).isEqualTo("INFO");
    }

    @Test
    @Tag("unit")
    void testEnvironmentMapping() {
        // Arrange
        Map<String, String> environment = Map.of(
                "JFRONT_PARSER_DEBUG", "true",
                "JFRONT_LEXER_IGNORE__ERRORS", "true",
                "JFRONT_", "ignored",
                "PATH", "/usr/bin");

        // Act
        Config config = ConfigLoader.fromEnvironment(environment);

        // Assert
        assertThat(config.getBoolean("jfront.parser.debug")).isTrue();
        assertThat(config.getBoolean("jfront.lexer.ignore-errors")).isTrue();
        assertThat(config.root().keySet()).containsExactly("jfront");
    }

    @Test
    @Tag("unit")
    void testMalformedFileFails() throws IOException {
        // Arrange
        Path file = tempDir.resolve("broken.conf");
        Files.writeString(file, "jfront { lexer {");

        // Act & Assert
        assertThatThrownBy(() -> ConfigLoader.load(file.toFile(), Map.of()))
                .isInstanceOf(ConfigException.class);
    }
}
