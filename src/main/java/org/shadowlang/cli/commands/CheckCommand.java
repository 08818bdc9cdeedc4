package org.shadowlang.cli.commands;

import org.shadowlang.cli.CommandLineInterface;
import org.shadowlang.compiler.Compiler;
import org.shadowlang.compiler.api.CompilationException;
import org.shadowlang.compiler.frontend.parser.AstPrinter;
import org.shadowlang.compiler.frontend.parser.ast.Ast;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(
    name = "check",
    description = "Lexes, parses and analyzes a source file without generating code.",
    exitCodeOnInvalidInput = CommandLineInterface.EXIT_COMPILATION_FAILED
)
public class CheckCommand extends AbstractSourceCommand implements Callable<Integer> {

    @Option(names = "--print-ast", description = "Print the analyzed program in source form.")
    private boolean printAst;

    @Override
    public Integer call() {
        Compiler compiler = new Compiler(loadOptions());
        Ast ast;
        try {
            ast = compiler.check(Files.readString(source, StandardCharsets.UTF_8), source.toString());
        } catch (CompilationException e) {
            printFailure(e);
            return CommandLineInterface.EXIT_COMPILATION_FAILED;
        } catch (IOException e) {
            printUnreadable(e);
            return CommandLineInterface.EXIT_COMPILATION_FAILED;
        }
        printWarnings(compiler.getDiagnostics());

        PrintWriter out = spec.commandLine().getOut();
        if (printAst) {
            out.print(AstPrinter.toSource(ast.root()));
        } else {
            out.println(source + ": OK");
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
