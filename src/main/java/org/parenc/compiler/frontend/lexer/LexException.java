package org.parenc.compiler.frontend.lexer;

import org.parenc.compiler.api.CompilationException;
import org.parenc.compiler.api.CompilerErrorCode;
import org.parenc.compiler.api.SourceInfo;

/**
 * Thrown by the {@link Lexer} when the input cannot be split into tokens.
 */
public class LexException extends CompilationException {

    private final String offendingText;

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     * @param offendingText The character or fragment that could not be scanned.
     * @param sourceInfo Where the offending text starts.
     */
    public LexException(CompilerErrorCode errorCode, String message, String offendingText, SourceInfo sourceInfo) {
        super(errorCode, message, sourceInfo);
        this.offendingText = offendingText;
    }

    /**
     * @return The character or fragment that could not be scanned.
     */
    public String getOffendingText() {
        return offendingText;
    }
}
