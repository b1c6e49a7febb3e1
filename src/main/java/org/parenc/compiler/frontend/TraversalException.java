package org.parenc.compiler.frontend;

import org.parenc.compiler.api.CompilerErrorCode;

/**
 * Thrown by the {@link Traverser} when a node does not have the shape every node must have.
 * A tree built by the parser or the transformer never triggers it.
 */
public class TraversalException extends RuntimeException {

    private final CompilerErrorCode errorCode;

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public TraversalException(CompilerErrorCode errorCode, String message) {
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
