package org.parenc.compiler.frontend.lexer;

import java.util.Locale;

/**
 * Controls how the {@link Lexer} groups digits into {@link TokenType#NUMBER} tokens.
 */
public enum NumeralMode {
    /** Every digit becomes its own token, so {@code 42} yields {@code 4} and {@code 2}. */
    SINGLE_DIGIT("single-digit"),
    /** Consecutive digits form one token. */
    MULTI_DIGIT("multi-digit");

    private final String configName;

    NumeralMode(String configName) {
        this.configName = configName;
    }

    /**
     * @return The name used for this mode in configuration files and on the command line.
     */
    public String configName() {
        return configName;
    }

    /**
     * Resolves a mode from its configuration name ({@code single-digit}) or enum name ({@code SINGLE_DIGIT}).
     *
     * @param name The name to resolve.
     * @return The matching mode.
     * @throws IllegalArgumentException if no mode matches.
     */
    public static NumeralMode fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (NumeralMode mode : values()) {
            if (mode.configName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown numeral mode: '" + name + "'. Expected 'single-digit' or 'multi-digit'.");
    }
}
