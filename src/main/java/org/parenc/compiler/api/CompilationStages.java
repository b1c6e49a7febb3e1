package org.parenc.compiler.api;

import org.parenc.compiler.frontend.lexer.Token;
import org.parenc.compiler.frontend.parser.ast.ProgramNode;
import org.parenc.compiler.ir.IrProgram;

import java.util.List;

/**
 * The result of every compiler phase for one input, in pipeline order.
 *
 * @param source The compiled program text.
 * @param tokens The tokens produced by the lexer.
 * @param sourceTree The tree produced by the parser.
 * @param loweredTree The tree produced by the transformer.
 * @param output The generated code.
 */
public record CompilationStages(
        String source,
        List<Token> tokens,
        ProgramNode sourceTree,
        IrProgram loweredTree,
        String output
) {

    public CompilationStages {
        tokens = List.copyOf(tokens);
    }
}
