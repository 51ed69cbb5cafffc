package org.lolmark.cli.commands;

import org.lolmark.cli.config.CompilerOptions;
import org.lolmark.cli.io.HtmlFileWriter;
import org.lolmark.compiler.Compiler;
import org.lolmark.compiler.api.CompilationException;
import org.lolmark.compiler.api.HtmlArtifact;
import org.lolmark.compiler.frontend.parser.ast.ProgramNode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;

@Command(name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compiles a .lol file and writes the HTML document next to it.")
public class CompileCommand extends AbstractSourceCommand {

    @Option(names = "--open", description = "Open the generated document in the browser.")
    private boolean open;

    @Option(names = {"-o", "--output"}, paramLabel = "DIR",
            description = "Directory to write the HTML file to (default: next to the source).")
    private Path outputDirectory;

    @Override
    protected int run(String source, CompilerOptions options, PrintWriter out) throws CompilationException, IOException {
        Compiler compiler = new Compiler(options.documentTitle());

        ProgramNode program = compiler.parse(source, programName());
        out.println("Parsing successful!");

        compiler.analyze(program);
        out.println("Semantic analysis completed successfully!");

        HtmlArtifact artifact = compiler.generate(program, programName());
        Path written = new HtmlFileWriter(options.outputExtension()).write(file(), artifact.html(), outputDirectory);
        out.println("HTML generated successfully: " + written);

        if (open || options.openInBrowser()) {
            parent().getBrowserLauncher().open(written);
        }
        return 0;
    }
}
