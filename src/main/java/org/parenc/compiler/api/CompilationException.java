package org.parenc.compiler.api;

/**
 * An exception that is thrown when an error occurs during the compilation process.
 * <p>
 * It is part of the public API. Every instance carries a {@link CompilerErrorCode} and,
 * where the error can be pinned to the input, the {@link SourceInfo} of the offending text.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final transient SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and source information.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the offending input.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        this(errorCode, message, sourceInfo, null);
    }

    private CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(sourceInfo != null ? String.format("%s at %s", message, sourceInfo) : message, cause);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The error code classifying this failure.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The position of the offending input, or {@code null} if the error has none.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
