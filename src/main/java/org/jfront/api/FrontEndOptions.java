package org.jfront.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Settings that influence how source text is tokenized and parsed.
 *
 * @param ignoreLexErrors If {@code true}, lexical errors are recorded and scanning continues.
 * @param debug If {@code true}, every traced parse procedure is logged at DEBUG level.
 */
public record FrontEndOptions(boolean ignoreLexErrors, boolean debug) {

    private static final String IGNORE_ERRORS_PATH = "jfront.lexer.ignore-errors";
    private static final String DEBUG_PATH = "jfront.parser.debug";

    /**
     * Reads the options from the {@code jfront} block of a configuration. Missing keys fall back to
     * {@code false}.
     *
     * @param config The application configuration.
     * @return The options.
     */
    public static FrontEndOptions fromConfig(Config config) {
        boolean ignoreErrors = config.hasPath(IGNORE_ERRORS_PATH) && config.getBoolean(IGNORE_ERRORS_PATH);
        boolean debug = config.hasPath(DEBUG_PATH) && config.getBoolean(DEBUG_PATH);
        return new FrontEndOptions(ignoreErrors, debug);
    }

    /**
     * @return The options defined by {@code reference.conf} and any overrides on the classpath.
     */
    public static FrontEndOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }

    public FrontEndOptions withIgnoreLexErrors(boolean ignoreLexErrors) {
        return new FrontEndOptions(ignoreLexErrors, debug);
    }

    public FrontEndOptions withDebug(boolean debug) {
        return new FrontEndOptions(ignoreLexErrors, debug);
    }
}
