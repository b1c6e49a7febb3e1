package org.parenc.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given source code.
     *
     * @param source The program text.
     * @return The generated code, one statement per top-level form.
     * @throws CompilationException if the source cannot be compiled.
     */
    default String compile(String source) throws CompilationException {
        return compileStages(source, "<memory>").output();
    }

    /**
     * Compiles the given source code and keeps the result of every phase.
     *
     * @param source The program text.
     * @param sourceName A name for the source, used in error positions.
     * @return The output of every phase.
     * @throws CompilationException if the source cannot be compiled.
     */
    CompilationStages compileStages(String source, String sourceName) throws CompilationException;

    /**
     * Compiles the source code from a UTF-8 file.
     *
     * @param programPath The path to the source file.
     * @return The generated code.
     * @throws CompilationException if the file cannot be read or compiled.
     */
    default String compile(Path programPath) throws CompilationException {
        return compileStages(programPath).output();
    }

    /**
     * Compiles the source code from a UTF-8 file and keeps the result of every phase.
     *
     * @param programPath The path to the source file.
     * @return The output of every phase.
     * @throws CompilationException if the file cannot be read or compiled.
     */
    default CompilationStages compileStages(Path programPath) throws CompilationException {
        String source;
        try {
            source = Files.readString(programPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompilationException(CompilerErrorCode.IO_ERROR_READING_FILE,
                    "Could not read source file " + programPath, e);
        }
        return compileStages(source, programPath.toString());
    }
}
