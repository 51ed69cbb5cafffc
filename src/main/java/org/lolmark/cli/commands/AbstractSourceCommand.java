package org.lolmark.cli.commands;

import com.typesafe.config.ConfigException;
import org.lolmark.cli.CommandLineInterface;
import org.lolmark.cli.config.CompilerOptions;
import org.lolmark.cli.io.SourceLoader;
import org.lolmark.compiler.api.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base class of the subcommands that read one source file.
 * <p>
 * It loads the configuration and the source, runs the command and maps every failure to
 * exit code 1. Compiler diagnostics go to the error stream, one per line.
 */
public abstract class AbstractSourceCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractSourceCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file to read.")
    private Path file;

    @Spec
    private CommandSpec spec;

    @Override
    public final Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            CompilerOptions options = parent.getCompilerOptions();
            String source = new SourceLoader(options.inputExtension()).load(file);
            return run(source, options, spec.commandLine().getOut());
        } catch (CompilationException e) {
            err.println(e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (ConfigException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.error("Failed to access '{}': {}", file, e.getMessage());
            return 1;
        } finally {
            err.flush();
        }
    }

    /**
     * Runs the command on the loaded source.
     * @param source The source text.
     * @param options The compiler options from the configuration.
     * @param out The standard output of the command.
     * @return The exit code.
     * @throws CompilationException if the source does not compile.
     * @throws IOException if an output file cannot be written.
     */
    protected abstract int run(String source, CompilerOptions options, PrintWriter out)
            throws CompilationException, IOException;

    protected Path file() {
        return file;
    }

    protected String programName() {
        return file.toString();
    }

    protected CommandLineInterface parent() {
        return parent;
    }
}
