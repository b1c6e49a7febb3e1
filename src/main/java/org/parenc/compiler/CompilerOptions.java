package org.parenc.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.parenc.compiler.frontend.lexer.NumeralMode;

/**
 * Settings that change how the compiler reads its input.
 *
 * @param numeralMode How the lexer groups digits into number tokens.
 */
public record CompilerOptions(NumeralMode numeralMode) {

    /** The configuration path of the compiler section. */
    public static final String CONFIG_PATH = "parenc.compiler";

    /**
     * @return The options used when nothing is configured: one token per digit.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(NumeralMode.SINGLE_DIGIT);
    }

    /**
     * Reads the options from the {@code parenc.compiler} section of a configuration.
     * Missing keys fall back to {@link #defaults()}.
     * <pre>
     * parenc.compiler {
     *   numerals = "single-digit"  # or "multi-digit"
     * }
     * </pre>
     *
     * @param config The application configuration.
     * @return The options.
     * @throws ConfigException.BadValue if a value is not recognized.
     */
    public static CompilerOptions fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH + ".numerals")) {
            return defaults();
        }
        String numerals = config.getString(CONFIG_PATH + ".numerals");
        try {
            return new CompilerOptions(NumeralMode.fromName(numerals));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), CONFIG_PATH + ".numerals", e.getMessage());
        }
    }

    /**
     * @param mode The numeral mode to use instead.
     * @return A copy of these options with a different numeral mode.
     */
    public CompilerOptions withNumeralMode(NumeralMode mode) {
        return new CompilerOptions(mode);
    }
}
