package org.lolmark.cli.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads source files, accepting only the configured source extension.
 */
public class SourceLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SourceLoader.class);

    private final String extension;

    /**
     * @param extension The required file extension without the dot, e.g. <code>lol</code>.
     */
    public SourceLoader(String extension) {
        this.extension = extension;
    }

    /**
     * Reads the whole file as UTF-8 text.
     * @param path The source file.
     * @return The file content.
     * @throws IllegalArgumentException if the file does not have the required extension.
     * @throws IOException if the file cannot be read.
     */
    public String load(Path path) throws IOException {
        if (!hasExtension(path)) {
            throw new IllegalArgumentException("input file must have a ." + extension + " extension");
        }
        String source = Files.readString(path, StandardCharsets.UTF_8);
        LOG.debug("Read {} characters from {}", source.length(), path);
        return source;
    }

    private boolean hasExtension(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().endsWith("." + extension);
    }
}
