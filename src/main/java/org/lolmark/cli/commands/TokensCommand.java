package org.lolmark.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lolmark.cli.config.CompilerOptions;
import org.lolmark.compiler.Compiler;
import org.lolmark.compiler.api.CompilationException;
import org.lolmark.compiler.frontend.lexer.Token;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.List;

@Command(name = "tokens",
        mixinStandardHelpOptions = true,
        description = "Runs only the lexer and prints the tokens of a .lol file.")
public class TokensCommand extends AbstractSourceCommand {

    /** Output formats of the token listing. */
    public enum Format { SUMMARY, JSON }

    @Option(names = "--format", defaultValue = "SUMMARY",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private Format format;

    @Override
    protected int run(String source, CompilerOptions options, PrintWriter out) throws CompilationException {
        List<Token> tokens = new Compiler(options.documentTitle()).tokenize(source, programName());

        if (format == Format.JSON) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(tokens));
            return 0;
        }

        for (Token token : tokens) {
            out.println(String.format("%d:%d %s", token.line(), token.column(), token.describe()));
        }
        out.println("valid");
        return 0;
    }
}
