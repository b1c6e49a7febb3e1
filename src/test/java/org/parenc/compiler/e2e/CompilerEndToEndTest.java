package org.parenc.compiler.e2e;

import org.parenc.compiler.Compiler;
import org.parenc.compiler.CompilerOptions;
import org.parenc.compiler.api.CompilationException;
import org.parenc.compiler.api.CompilationStages;
import org.parenc.compiler.api.CompilerErrorCode;
import org.parenc.compiler.frontend.lexer.LexException;
import org.parenc.compiler.frontend.lexer.NumeralMode;
import org.parenc.compiler.frontend.lexer.Token;
import org.parenc.compiler.frontend.parser.ParseException;
import org.parenc.compiler.frontend.parser.Parser;
import org.parenc.junit.extensions.logging.FailOnLog;
import org.parenc.junit.extensions.logging.LogLevel;
import org.parenc.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains end-to-end tests for the {@link Compiler}.
 * These tests compile source code from in-memory strings (and one temporary file)
 * and verify the generated code. The compiler itself reports failures only through exceptions,
 * so any log at INFO or above fails a test.
 */
@ExtendWith(LogWatchExtension.class)
@FailOnLog(level = LogLevel.INFO)
public class CompilerEndToEndTest {

    private final Compiler compiler = new Compiler();

    @Test
    @Tag("unit")
    void compilesNestedCall() throws Exception {
        assertThat(compiler.compile("(add 2 (subtract 4 2))")).isEqualTo("add(2, subtract(4, 2));");
    }

    @Test
    @Tag("unit")
    void compilesDeeplyNestedCalls() throws Exception {
        assertThat(compiler.compile("(a (b (c (d 1) 2) 3) (e))"))
                .isEqualTo("a(b(c(d(1), 2), 3), e());");
    }

    /**
     * Nesting right at the parser's limit still compiles; the lowering and printing walks cope with it.
     */
    @Test
    @Tag("unit")
    void compilesCallsNestedToTheLimit() throws Exception {
        // Arrange
        int depth = Parser.MAX_NESTING_DEPTH;
        String source = "(a ".repeat(depth) + ")".repeat(depth);

        // Act
        String output = compiler.compile(source);

        // Assert
        assertThat(output).isEqualTo("a(".repeat(depth) + ")".repeat(depth) + ";");
    }

    /**
     * Pathologically deep input fails with a diagnostic instead of exhausting the stack.
     */
    @Test
    @Tag("unit")
    void rejectsRunawayNestingWithDiagnostic() {
        // Arrange
        String source = "(a ".repeat(20000) + ")".repeat(20000);

        // Act & Assert
        assertThatThrownBy(() -> compiler.compile(source))
                .isInstanceOfSatisfying(ParseException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.NESTING_TOO_DEEP));
    }

    /**
     * String content survives unchanged, including spaces and parentheses.
     */
    @Test
    @Tag("unit")
    void keepsStringContentVerbatim() throws Exception {
        assertThat(compiler.compile("(print \"hello (world)\" 7)")).isEqualTo("print(\"hello (world)\", 7);");
    }

    @Test
    @Tag("unit")
    void emitsOneStatementPerTopLevelForm() throws Exception {
        String source = String.join("\n",
                "(print \"start\")",
                "(add 1 2)",
                "(stop)");

        assertThat(compiler.compile(source)).isEqualTo("print(\"start\");\nadd(1, 2);\nstop();");
    }

    /**
     * In the default mode a two-digit numeral becomes two arguments.
     */
    @Test
    @Tag("unit")
    void splitsMultiDigitNumeralsByDefault() throws Exception {
        assertThat(compiler.compile("(add 42 7)")).isEqualTo("add(4, 2, 7);");
    }

    @Test
    @Tag("unit")
    void keepsMultiDigitNumeralsWhenEnabled() throws Exception {
        Compiler multiDigit = new Compiler(new CompilerOptions(NumeralMode.MULTI_DIGIT));

        assertThat(multiDigit.compile("(add 42 7)")).isEqualTo("add(42, 7);");
    }

    @Test
    @Tag("unit")
    void compilesEmptySourceToEmptyOutput() throws Exception {
        assertThat(compiler.compile("   \n")).isEmpty();
    }

    @Test
    @Tag("unit")
    void exposesEveryStage() throws Exception {
        CompilationStages stages = compiler.compileStages("(f 1)", "stage.lisp");

        assertThat(stages.source()).isEqualTo("(f 1)");
        assertThat(stages.tokens()).extracting(Token::text).containsExactly("(", "f", "1", ")");
        assertThat(stages.sourceTree().body()).hasSize(1);
        assertThat(stages.loweredTree().body()).hasSize(1);
        assertThat(stages.output()).isEqualTo("f(1);");
    }

    @Test
    @Tag("unit")
    void reportsLexErrorsWithSourceName() {
        assertThatThrownBy(() -> compiler.compileStages("(add 2 #)", "bad.lisp"))
                .isInstanceOf(LexException.class)
                .hasMessageContaining("'#'")
                .hasMessageContaining("bad.lisp:1:8");
    }

    @Test
    @Tag("unit")
    void reportsParseErrors() {
        assertThatThrownBy(() -> compiler.compile("(add 2"))
                .isInstanceOfSatisfying(ParseException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNBALANCED_PARENTHESES));
    }

    @Test
    @Tag("unit")
    void compilesFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("program.lisp");
        Files.writeString(file, "(concat \"a\" \"b\")\n", StandardCharsets.UTF_8);

        assertThat(compiler.compile(file)).isEqualTo("concat(\"a\", \"b\");");
    }

    @Test
    @Tag("unit")
    void reportsUnreadableFile(@TempDir Path dir) {
        Path missing = dir.resolve("missing.lisp");

        assertThatThrownBy(() -> compiler.compile(missing))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.IO_ERROR_READING_FILE))
                .hasMessageContaining("missing.lisp");
    }

    /**
     * One compiler instance can serve several threads at once.
     */
    @Test
    @Tag("unit")
    void compilesConcurrently() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                String name = "f" + "x".repeat(i % 5);
                results.add(executor.submit(() -> compiler.compile("(" + name + " 1 (g \"s\"))")));
            }
            for (int i = 0; i < results.size(); i++) {
                String name = "f" + "x".repeat(i % 5);
                assertThat(results.get(i).get(5, TimeUnit.SECONDS)).isEqualTo(name + "(1, g(\"s\"));");
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
