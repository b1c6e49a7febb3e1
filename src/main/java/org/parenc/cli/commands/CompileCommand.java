package org.parenc.cli.commands;

import org.parenc.cli.CommandLineInterface;
import org.parenc.compiler.Compiler;
import org.parenc.compiler.CompilerOptions;
import org.parenc.compiler.api.CompilationException;
import org.parenc.compiler.api.CompilationStages;
import org.parenc.compiler.frontend.lexer.NumeralMode;
import org.parenc.compiler.util.StageDump;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles a prefix-notation program to C-style calls.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Input input;

    static class Input {
        @Option(names = {"-e", "--expression"}, required = true, description = "The program text to compile.")
        String expression;

        @Option(names = {"-f", "--file"}, required = true, description = "The path to a source file (UTF-8).")
        File file;
    }

    @Option(names = "--stages", description = "Also print the input, tokens, source tree and lowered tree as JSON.")
    private boolean stages;

    @Option(names = "--numerals", paramLabel = "MODE",
            description = "How digits form numbers: single-digit or multi-digit. Overrides the configuration.")
    private String numerals;

    @Option(names = "--no-color", description = "Print the stages without ANSI colors.")
    private boolean noColor;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        CompilerOptions options = CompilerOptions.fromConfig(parent.getConfig());
        if (numerals != null) {
            try {
                options = options.withNumeralMode(NumeralMode.fromName(numerals));
            } catch (IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
            }
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Compiler compiler = new Compiler(options);
            CompilationStages result = input.file != null
                    ? compiler.compileStages(input.file.toPath())
                    : compiler.compileStages(input.expression, "<expression>");
            if (stages) {
                printStages(out, result);
            }
            out.println(stages ? colored(result.output(), Ansi.Style.fg_yellow) : result.output());
            out.flush();
            return 0;
        } catch (CompilationException e) {
            log.error("Compilation failed [{}]: {}", e.getErrorCode(), e.getMessage());
            err.println("error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private void printStages(PrintWriter out, CompilationStages result) {
        out.println(colored(result.source(), Ansi.Style.fg_red));
        out.println(colored(StageDump.tokens(result.tokens()), Ansi.Style.fg_blue));
        out.println(colored(StageDump.sourceTree(result.sourceTree()), Ansi.Style.fg_green));
        out.println(colored(StageDump.loweredTree(result.loweredTree()), Ansi.Style.fg_cyan));
    }

    private String colored(String text, Ansi.Style color) {
        Ansi ansi = noColor ? Ansi.OFF : spec.commandLine().getColorScheme().ansi();
        if (!ansi.enabled()) {
            return text;
        }
        return color.on() + text + color.off();
    }
}
