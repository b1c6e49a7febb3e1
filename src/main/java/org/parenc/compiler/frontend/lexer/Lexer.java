package org.parenc.compiler.frontend.lexer;

import org.parenc.compiler.api.CompilerErrorCode;
import org.parenc.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * The input is scanned left to right with a single cursor and without backtracking.
 * The first character that starts no token aborts the scan with a {@link LexException}.
 */
public class Lexer {

    private final String source;
    private final NumeralMode numeralMode;
    private final String logicalFileName;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer that emits one token per digit.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, NumeralMode.SINGLE_DIGIT, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit numeral mode and logical file name.
     * @param source The source code as a single string.
     * @param numeralMode How digits are grouped into number tokens.
     * @param logicalFileName The name of the source, for error reporting.
     */
    public Lexer(String source, NumeralMode numeralMode, String logicalFileName) {
        this.source = source;
        this.numeralMode = numeralMode;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return An unmodifiable list of the recognized tokens.
     * @throws LexException if an unknown character or an unterminated string is found.
     */
    public List<Token> scanTokens() throws LexException {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        return List.copyOf(tokens);
    }

    private void scanToken() throws LexException {
        char c = advance();
        if (c == '(' || c == ')') {
            addToken(TokenType.PAREN);
        } else if (Character.isWhitespace(c)) {
            if (c == '\n') {
                line++;
                column = 1;
            }
        } else if (isDigit(c)) {
            number();
        } else if (c == '"') {
            string();
        } else if (isAlpha(c)) {
            name();
        } else {
            throw new LexException(CompilerErrorCode.UNEXPECTED_CHARACTER,
                    "Unexpected character '" + c + "'", String.valueOf(c), position());
        }
    }

    private void number() {
        if (numeralMode == NumeralMode.MULTI_DIGIT) {
            while (isDigit(peek())) advance();
        }
        addToken(TokenType.NUMBER);
    }

    private void string() throws LexException {
        while (peek() != '"' && !isAtEnd()) {
            if (advance() == '\n') {
                line++;
                column = 1;
            }
        }

        if (isAtEnd()) {
            throw new LexException(CompilerErrorCode.UNTERMINATED_STRING,
                    "Unterminated string", source.substring(start), position());
        }

        // The closing "
        advance();
        addToken(TokenType.STRING, source.substring(start + 1, current - 1));
    }

    private void name() {
        while (isAlpha(peek())) advance();
        addToken(TokenType.NAME);
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, source.substring(start, current));
    }

    private void addToken(TokenType type, String text) {
        tokens.add(new Token(type, text, startLine, startColumn));
    }

    private SourceInfo position() {
        return new SourceInfo(logicalFileName, startLine, startColumn);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
