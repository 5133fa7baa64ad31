package org.jfront.api;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class FrontEndOptionsTest {

    @Test
    @Tag("unit")
    void testFromConfig() {
        // Arrange
        String hocon = "jfront { lexer { ignore-errors = true }, parser { debug = false } }";

        // Act
        FrontEndOptions options = FrontEndOptions.fromConfig(ConfigFactory.parseString(hocon));

        // Assert
        assertThat(options.ignoreLexErrors()).isTrue();
        assertThat(options.debug()).isFalse();
    }

    /**
     * Missing settings fall back to {@code false}.
     */
    @Test
    @Tag("unit")
    void testMissingKeysDefaultToFalse() {
        // Act
        FrontEndOptions options = FrontEndOptions.fromConfig(ConfigFactory.empty());

        // Assert
        assertThat(options).isEqualTo(new FrontEndOptions(false, false));
    }

    @Test
    @Tag("unit")
    void testWithers() {
        // Act
        FrontEndOptions options = new FrontEndOptions(false, false).withDebug(true).withIgnoreLexErrors(true);

        // Assert
        assertThat(options).isEqualTo(new FrontEndOptions(true, true));
    }
}
