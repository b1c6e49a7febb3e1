package org.parenc.compiler;

import org.parenc.compiler.api.CompilationException;
import org.parenc.compiler.api.CompilationStages;
import org.parenc.compiler.api.ICompiler;
import org.parenc.compiler.backend.emit.CodeGenerator;
import org.parenc.compiler.frontend.lexer.Lexer;
import org.parenc.compiler.frontend.lexer.Token;
import org.parenc.compiler.frontend.parser.Parser;
import org.parenc.compiler.frontend.parser.ast.ProgramNode;
import org.parenc.compiler.frontend.transform.Transformer;
import org.parenc.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from
 * prefix-call source text to C-style call syntax:
 * lexing, parsing, lowering and code generation.
 * <p>
 * Every phase object is created per call, so one instance can be shared between threads.
 */
public class Compiler implements ICompiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CompilerOptions options;

    /**
     * Creates a compiler with {@link CompilerOptions#defaults()}.
     */
    public Compiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * @param options The options controlling lexing.
     */
    public Compiler(CompilerOptions options) {
        this.options = options;
    }

    @Override
    public CompilationStages compileStages(String source, String sourceName) throws CompilationException {
        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(source, options.numeralMode(), sourceName).scanTokens();
        log.debug("{}: lexed {} tokens", sourceName, tokens.size());

        // Phase 2: Parsing (builds AST)
        ProgramNode ast = new Parser(tokens, sourceName).parse();
        log.debug("{}: parsed {} top-level forms", sourceName, ast.body().size());

        // Phase 3: Lowering
        IrProgram ir = new Transformer().transform(ast);

        // Phase 4: Code Generation
        String output = new CodeGenerator().generate(ir);
        log.debug("{}: generated {} characters", sourceName, output.length());

        return new CompilationStages(source, tokens, ast, ir, output);
    }

    /**
     * @return The options this compiler was created with.
     */
    public CompilerOptions getOptions() {
        return options;
    }
}
