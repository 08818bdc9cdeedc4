package org.shadowlang.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.shadowlang.cli.CommandLineInterface;
import org.shadowlang.compiler.Compiler;
import org.shadowlang.compiler.api.AssemblyDocument;
import org.shadowlang.compiler.api.CompilationException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "emit",
    description = "Compiles a source file and prints the generated assembly.",
    exitCodeOnInvalidInput = CommandLineInterface.EXIT_COMPILATION_FAILED
)
public class EmitCommand extends AbstractSourceCommand implements Callable<Integer> {

    @Option(names = "--json", description = "Print the assembly document as JSON instead of assembler text.")
    private boolean json;

    @Override
    public Integer call() {
        Compiler compiler = new Compiler(loadOptions());
        AssemblyDocument document;
        try {
            document = compiler.compile(source);
        } catch (CompilationException e) {
            printFailure(e);
            return CommandLineInterface.EXIT_COMPILATION_FAILED;
        } catch (IOException e) {
            printUnreadable(e);
            return CommandLineInterface.EXIT_COMPILATION_FAILED;
        }
        printWarnings(compiler.getDiagnostics());

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(document));
        } else {
            out.print(document.render());
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
