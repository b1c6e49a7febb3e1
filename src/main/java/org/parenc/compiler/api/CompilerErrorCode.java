package org.parenc.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that starts no known token was found. */
    UNEXPECTED_CHARACTER,
    /** A string literal was opened but never closed. */
    UNTERMINATED_STRING,
    // endregion

    // region Parser Errors
    /** A token appeared where no expression can start. */
    UNEXPECTED_TOKEN,
    /** An opening parenthesis was not followed by a call name. */
    MISSING_CALL_NAME,
    /** The input ended before a call expression was closed. */
    UNBALANCED_PARENTHESES,
    /** Calls were nested deeper than the parser allows. */
    NESTING_TOO_DEEP,
    // endregion

    // region Internal Errors
    /** A tree node reported a missing child list or a missing child. */
    MALFORMED_NODE,
    /** The code generator was handed a node it cannot render. */
    UNSUPPORTED_NODE,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE
    // endregion
}
