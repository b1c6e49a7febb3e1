package org.parenc.compiler.frontend.parser;

import org.parenc.compiler.api.CompilerErrorCode;
import org.parenc.compiler.api.SourceInfo;
import org.parenc.compiler.frontend.lexer.Token;
import org.parenc.compiler.frontend.lexer.TokenType;
import org.parenc.compiler.frontend.parser.ast.AstNode;
import org.parenc.compiler.frontend.parser.ast.CallExpressionNode;
import org.parenc.compiler.frontend.parser.ast.NumberLiteralNode;
import org.parenc.compiler.frontend.parser.ast.ProgramNode;
import org.parenc.compiler.frontend.parser.ast.StringLiteralNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A recursive descent parser. It consumes a list of tokens from the
 * {@link org.parenc.compiler.frontend.lexer.Lexer} and produces the source
 * Abstract Syntax Tree (AST), rooted at a {@link ProgramNode}.
 * <p>
 * There is no error recovery: the first malformed construct aborts parsing.
 * Calls may nest at most {@link #MAX_NESTING_DEPTH} levels deep.
 */
public class Parser {

    /** The deepest call nesting the parser accepts. */
    public static final int MAX_NESTING_DEPTH = 1000;

    private final List<Token> tokens;
    private final String logicalFileName;
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     */
    public Parser(List<Token> tokens) {
        this(tokens, "<memory>");
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param logicalFileName The name of the source, for error reporting.
     */
    public Parser(List<Token> tokens, String logicalFileName) {
        this.tokens = tokens;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Parses the entire token stream.
     * @return The program holding every top-level expression.
     * @throws ParseException if the tokens do not form a valid program.
     */
    public ProgramNode parse() throws ParseException {
        List<AstNode> body = new ArrayList<>();
        while (!isAtEnd()) {
            body.add(expression());
        }
        return new ProgramNode(body);
    }

    /**
     * Parses a single expression: a number, a string or a parenthesized call.
     * @return The parsed {@link AstNode}.
     * @throws ParseException if the current token cannot start an expression.
     */
    AstNode expression() throws ParseException {
        Token token = advance();
        if (token.type() == TokenType.NUMBER) return new NumberLiteralNode(token.text());
        if (token.type() == TokenType.STRING) return new StringLiteralNode(token.text());
        if (token.isOpenParen()) return call(token);

        throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN,
                "Unexpected " + describe(token) + ", expected a number, a string or '('", sourceOf(token));
    }

    private CallExpressionNode call(Token openParen) throws ParseException {
        if (++depth > MAX_NESTING_DEPTH) {
            throw new ParseException(CompilerErrorCode.NESTING_TOO_DEEP,
                    "Calls are nested deeper than " + MAX_NESTING_DEPTH + " levels", sourceOf(openParen));
        }
        if (isAtEnd() || peek().type() != TokenType.NAME) {
            String found = isAtEnd() ? "end of input" : describe(peek());
            Token at = isAtEnd() ? openParen : peek();
            throw new ParseException(CompilerErrorCode.MISSING_CALL_NAME,
                    "Expected a call name after '(', but found " + found, sourceOf(at));
        }
        String name = advance().text();

        List<AstNode> params = new ArrayList<>();
        while (!isAtEnd() && !peek().isCloseParen()) {
            params.add(expression());
        }
        if (isAtEnd()) {
            throw new ParseException(CompilerErrorCode.UNBALANCED_PARENTHESES,
                    "Missing ')' to close call to '" + name + "'", sourceOf(openParen));
        }
        advance(); // the closing ')'
        depth--;
        return new CallExpressionNode(name, params);
    }

    private String describe(Token token) {
        return token.type().name().toLowerCase(Locale.ROOT) + " '" + token.text() + "'";
    }

    private SourceInfo sourceOf(Token token) {
        return new SourceInfo(logicalFileName, token.line(), token.column());
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }
}
