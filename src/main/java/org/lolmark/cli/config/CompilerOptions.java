package org.lolmark.cli.config;

import com.typesafe.config.Config;

/**
 * Typed view of the <code>lolmark.compiler</code> configuration block.
 *
 * @param documentTitle The text of the generated document's title element.
 * @param inputExtension The extension source files must have, without the dot.
 * @param outputExtension The extension of written HTML files, without the dot.
 * @param openInBrowser Whether {@code compile} opens the result even without {@code --open}.
 */
public record CompilerOptions(
        String documentTitle,
        String inputExtension,
        String outputExtension,
        boolean openInBrowser
) {

    /** The configuration path of the compiler block. */
    public static final String CONFIG_PATH = "lolmark.compiler";

    /**
     * Reads the options from the application configuration.
     * @param config The resolved configuration, including the classpath defaults.
     * @return The options.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config compiler = config.getConfig(CONFIG_PATH);
        return new CompilerOptions(
                compiler.getString("document-title"),
                compiler.getString("input-extension"),
                compiler.getString("output-extension"),
                compiler.getBoolean("open-in-browser"));
    }
}
