package org.lolmark.cli.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests output path derivation and writing of {@link HtmlFileWriter}.
 */
public class HtmlFileWriterTest {

    @TempDir
    Path tempDir;

    private final HtmlFileWriter writer = new HtmlFileWriter("html");

    @Test
    @Tag("unit")
    void testOutputIsPlacedNextToSource() {
        Path source = tempDir.resolve("docs").resolve("page.lol");

        assertThat(writer.outputPathFor(source, null)).isEqualTo(tempDir.resolve("docs").resolve("page.html"));
    }

    @Test
    @Tag("unit")
    void testOnlyLastExtensionIsReplaced() {
        Path source = tempDir.resolve("my.page.lol");

        assertThat(writer.outputPathFor(source, null).getFileName().toString()).isEqualTo("my.page.html");
    }

    @Test
    @Tag("unit")
    void testWritesIntoMissingOutputDirectory() throws Exception {
        Path source = tempDir.resolve("page.lol");
        Path outputDirectory = tempDir.resolve("out").resolve("nested");

        Path written = writer.write(source, "<html>ä</html>", outputDirectory);

        assertThat(written).isEqualTo(outputDirectory.resolve("page.html"));
        assertThat(Files.readString(written)).isEqualTo("<html>ä</html>");
    }

    @Test
    @Tag("unit")
    void testOverwritesExistingFile() throws Exception {
        Path source = tempDir.resolve("page.lol");
        Files.writeString(tempDir.resolve("page.html"), "old content that is longer");

        Path written = writer.write(source, "new", null);

        assertThat(Files.readString(written)).isEqualTo("new");
    }
}
