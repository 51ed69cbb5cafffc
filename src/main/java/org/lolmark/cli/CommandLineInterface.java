package org.lolmark.cli;

import com.typesafe.config.Config;
import org.lolmark.cli.commands.CheckCommand;
import org.lolmark.cli.commands.CompileCommand;
import org.lolmark.cli.commands.TokensCommand;
import org.lolmark.cli.config.CompilerOptions;
import org.lolmark.cli.config.ConfigLoader;
import org.lolmark.cli.config.LoggingConfigurator;
import org.lolmark.cli.io.BrowserLauncher;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "lolmark",
    mixinStandardHelpOptions = true,
    version = "lolmark 1.0",
    description = "Compiles LOLCODE-markdown documents to HTML",
    subcommands = {
        CompileCommand.class,
        CheckCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private BrowserLauncher browserLauncher;

    public CommandLineInterface() {
        this(null);
    }

    /**
     * @param browserLauncher The launcher used by {@code compile --open}, or {@code null} to
     *                        create the desktop launcher on first use.
     */
    public CommandLineInterface(BrowserLauncher browserLauncher) {
        this.browserLauncher = browserLauncher;
    }

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Creates the command line with the settings the application runs with.
     * @param cli The root command instance.
     * @return The configured command line.
     */
    public static CommandLine commandLine(CommandLineInterface cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCommandName("lolmark");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    public static void main(final String[] args) {
        final int exitCode = commandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first access and applies its logging settings.
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    public CompilerOptions getCompilerOptions() {
        return CompilerOptions.fromConfig(getConfig());
    }

    public BrowserLauncher getBrowserLauncher() {
        if (browserLauncher == null) {
            browserLauncher = new BrowserLauncher();
        }
        return browserLauncher;
    }
}
