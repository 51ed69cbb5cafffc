package org.lolmark.cli.commands;

import org.lolmark.cli.config.CompilerOptions;
import org.lolmark.compiler.Compiler;
import org.lolmark.compiler.api.CompilationException;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

@Command(name = "check",
        mixinStandardHelpOptions = true,
        description = "Validates a .lol file without writing any output.")
public class CheckCommand extends AbstractSourceCommand {

    @Override
    protected int run(String source, CompilerOptions options, PrintWriter out) throws CompilationException {
        new Compiler(options.documentTitle()).check(source, programName());
        out.println("valid");
        return 0;
    }
}
