package org.parenc.compiler.frontend.parser;

import org.parenc.compiler.api.CompilationException;
import org.parenc.compiler.api.CompilerErrorCode;
import org.parenc.compiler.api.SourceInfo;

/**
 * Thrown by the {@link Parser} when the token stream does not form a valid program.
 */
public class ParseException extends CompilationException {

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the offending token.
     */
    public ParseException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(errorCode, message, sourceInfo);
    }
}
