package org.parenc.compiler.backend.emit;

import org.parenc.compiler.api.CompilerErrorCode;

/**
 * Thrown by the {@link CodeGenerator} when it is handed something it cannot render.
 * A tree built by the transformer never triggers it.
 */
public class CodeGenException extends RuntimeException {

    private final CompilerErrorCode errorCode;

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public CodeGenException(CompilerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * @return The error code classifying this failure.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }
}
