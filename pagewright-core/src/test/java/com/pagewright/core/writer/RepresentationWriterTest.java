package com.pagewright.core.writer;

import com.pagewright.core.config.CompilerConfig;
import com.pagewright.core.error.OutputWriteException;
import com.pagewright.core.model.SnapshotName;
import com.pagewright.core.rep.Representation;
import com.pagewright.core.rep.RepresentationTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RepresentationWriter}.
 */
class RepresentationWriterTest extends RepresentationTestBase {

    private static final FileTime LONG_AGO = FileTime.from(Instant.parse("2001-01-01T00:00:00Z"));

    @Test
    void write_withoutRawPath_doesNothing() {
        // Given
        Representation rep = textualRep("/about/", "hello");
        RepresentationWriter writer = new RepresentationWriter(bus);

        // When
        Optional<WriteResult> result = writer.write(rep, SnapshotName.LAST);

        // Then
        assertThat(result).isEmpty();
        assertThat(events.events()).isEmpty();
        assertThat(tempDir.resolve("output")).doesNotExist();
    }

    @Test
    void write_textualToNewFile_createsParentsAndReportsCreated() {
        // Given
        Representation rep = textualRep("/about/", "Hallo Welt");
        Path out = output("nested/dirs/about.html");
        rep.setRawPath(SnapshotName.LAST, out);
        RepresentationWriter writer = new RepresentationWriter(bus);

        // When
        WriteResult result = writer.write(rep, SnapshotName.LAST).orElseThrow();

        // Then
        assertThat(out).hasContent("Hallo Welt");
        assertThat(result.action()).isEqualTo(FileAction.CREATE);
        assertThat(events.events()).containsExactly(
            "willWriteRep /about/ (default) :last",
            "repWritten /about/ (default) about.html created=true modified=true"
        );
    }

    @Test
    void write_textualWithIdenticalContent_keepsModificationTime() throws IOException {
        // Given
        Representation rep = textualRep("/about/", "Hallo Welt");
        Path out = output("about.html");
        Files.createDirectories(out.getParent());
        Files.writeString(out, "Hallo Welt");
        Files.setLastModifiedTime(out, LONG_AGO);
        rep.setRawPath(SnapshotName.LAST, out);

        // When
        WriteResult result = new RepresentationWriter(bus).write(rep, SnapshotName.LAST).orElseThrow();

        // Then
        assertThat(result.action()).isEqualTo(FileAction.IDENTICAL);
        assertThat(Files.getLastModifiedTime(out)).isEqualTo(LONG_AGO);
        assertThat(events.eventsStartingWith("repWritten"))
            .containsExactly("repWritten /about/ (default) about.html created=false modified=false");
    }

    @Test
    void write_textualWithChangedContent_updatesFile() throws IOException {
        // Given
        Representation rep = textualRep("/about/", "Hallo Welt");
        Path out = output("about.html");
        Files.createDirectories(out.getParent());
        Files.writeString(out, "Hello World");
        Files.setLastModifiedTime(out, LONG_AGO);
        rep.setRawPath(SnapshotName.LAST, out);

        // When
        WriteResult result = new RepresentationWriter(bus).write(rep, SnapshotName.LAST).orElseThrow();

        // Then
        assertThat(result.action()).isEqualTo(FileAction.UPDATE);
        assertThat(out).hasContent("Hallo Welt");
        assertThat(Files.getLastModifiedTime(out)).isNotEqualTo(LONG_AGO);
    }

    @Test
    void write_textualNamedSnapshot_writesLastContent() {
        // Given
        Representation rep = textualRep("/about/", "raw");
        SnapshotName foo = SnapshotName.of("foo");
        rep.snapshot(foo, false);
        rep.filter("upcase");
        rep.setRawPath(foo, output("foo.html"));

        // When
        WriteResult result = new RepresentationWriter(bus).write(rep, foo).orElseThrow();

        // Then
        assertThat(result.snapshot()).isEqualTo(foo);
        assertThat(output("foo.html")).hasContent("RAW");
    }

    @Test
    void write_binaryToNewFile_copiesFile() throws IOException {
        // Given
        Representation rep = binaryRep("/logo/", "binary stuff");
        Path out = output("logo.png");
        rep.setRawPath(SnapshotName.LAST, out);

        // When
        WriteResult result = new RepresentationWriter(bus).write(rep, SnapshotName.LAST).orElseThrow();

        // Then
        assertThat(out).hasContent("binary stuff");
        assertThat(result.action()).isEqualTo(FileAction.CREATE);
    }

    @Test
    void write_binaryWithIdenticalContent_keepsModificationTime() throws IOException {
        // Given
        Representation rep = binaryRep("/logo/", "binary stuff");
        Path out = output("logo.png");
        Files.createDirectories(out.getParent());
        Files.writeString(out, "binary stuff");
        Files.setLastModifiedTime(out, LONG_AGO);
        rep.setRawPath(SnapshotName.LAST, out);

        // When
        WriteResult result = new RepresentationWriter(bus).write(rep, SnapshotName.LAST).orElseThrow();

        // Then
        assertThat(result.action()).isEqualTo(FileAction.IDENTICAL);
        assertThat(Files.getLastModifiedTime(out)).isEqualTo(LONG_AGO);
    }

    @Test
    void write_withReportIdenticalDisabled_omitsUntouchedFiles() throws IOException {
        // Given
        Representation rep = textualRep("/about/", "same");
        Path out = output("about.html");
        Files.createDirectories(out.getParent());
        Files.writeString(out, "same");
        rep.setRawPath(SnapshotName.LAST, out);
        RepresentationWriter writer = new RepresentationWriter(bus, StandardCharsets.UTF_8, false);

        // When
        WriteResult result = writer.write(rep, SnapshotName.LAST).orElseThrow();

        // Then
        assertThat(result.action()).isEqualTo(FileAction.IDENTICAL);
        assertThat(events.events()).containsExactly("willWriteRep /about/ (default) :last");
    }

    @Test
    void write_withConfiguredCharset_encodesText() throws IOException {
        // Given
        Representation rep = textualRep("/about/", "Grüße");
        Path out = output("about.html");
        rep.setRawPath(SnapshotName.LAST, out);
        CompilerConfig config = new CompilerConfig(null, new CompilerConfig.WriterConfig(true, "ISO-8859-1"));

        // When
        RepresentationWriter.fromConfig(config, bus).write(rep, SnapshotName.LAST);

        // Then
        assertThat(Files.readAllBytes(out)).isEqualTo("Grüße".getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void write_toDirectory_throwsOutputWriteException() throws IOException {
        // Given
        Representation rep = textualRep("/about/", "hello");
        Path out = output("taken");
        Files.createDirectories(out.resolve("child"));
        rep.setRawPath(SnapshotName.LAST, out);

        // When / Then
        assertThatThrownBy(() -> new RepresentationWriter(bus).write(rep, SnapshotName.LAST))
            .isInstanceOf(OutputWriteException.class)
            .hasMessageContaining("taken")
            .hasCauseInstanceOf(IOException.class);
    }
}
