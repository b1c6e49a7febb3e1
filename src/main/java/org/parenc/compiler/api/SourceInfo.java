package org.parenc.compiler.api;

/**
 * A position in a source text.
 *
 * @param sourceName The logical name of the source (a file name or {@code <memory>}).
 * @param line       The 1-based line number.
 * @param column     The 1-based column number.
 */
public record SourceInfo(String sourceName, int line, int column) {

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
