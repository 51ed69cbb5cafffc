package org.lolmark.cli.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a generated document under the source file's name with the output extension.
 */
public class HtmlFileWriter {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlFileWriter.class);

    private final String extension;

    /**
     * @param extension The extension of written files without the dot, e.g. <code>html</code>.
     */
    public HtmlFileWriter(String extension) {
        this.extension = extension;
    }

    /**
     * Computes where the document for {@code source} is written.
     * @param source The source file.
     * @param outputDirectory The target directory, or {@code null} to write next to the source.
     * @return The output path, e.g. <code>page.html</code> for <code>page.lol</code>.
     */
    public Path outputPathFor(Path source, Path outputDirectory) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String outputName = stem + "." + extension;

        if (outputDirectory != null) {
            return outputDirectory.resolve(outputName);
        }
        return source.resolveSibling(outputName);
    }

    /**
     * Writes the document, replacing any existing file. Missing output directories are created.
     * @param source The source file the document was compiled from.
     * @param html The document text.
     * @param outputDirectory The target directory, or {@code null} to write next to the source.
     * @return The written file.
     * @throws IOException if the file cannot be written.
     */
    public Path write(Path source, String html, Path outputDirectory) throws IOException {
        Path target = outputPathFor(source, outputDirectory);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, html, StandardCharsets.UTF_8);
        LOG.debug("Wrote {} characters to {}", html.length(), target);
        return target;
    }
}
