package com.pagewright.core.writer;

import com.pagewright.core.config.CompilerConfig;
import com.pagewright.core.error.OutputWriteException;
import com.pagewright.core.event.CompilationListener;
import com.pagewright.core.model.SnapshotName;
import com.pagewright.core.rep.Representation;
import com.pagewright.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes compiled representations to their output files.
 *
 * <p>Writing is idempotent: when the output file already holds the exact bytes that
 * would be written, the file is left alone and keeps its modification time. Tools that
 * detect changes through timestamps therefore only see files whose content changed.
 *
 * <p>Textual representations always write their {@link SnapshotName#LAST} content,
 * whichever snapshot triggered the write. Binary representations copy the file
 * recorded for the snapshot.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * rep.setRawPath(SnapshotName.LAST, Paths.get("output/about/index.html"));
 * Optional<WriteResult> result = writer.write(rep, SnapshotName.LAST);
 * // result.get().action() is CREATE, UPDATE or IDENTICAL
 * }</pre>
 */
public class RepresentationWriter {

    private static final Logger log = LoggerFactory.getLogger(RepresentationWriter.class);

    private final CompilationListener listener;
    private final Charset charset;
    private final boolean reportIdentical;

    public RepresentationWriter(CompilationListener listener) {
        this(listener, StandardCharsets.UTF_8, true);
    }

    /**
     * Creates a writer.
     *
     * @param listener receives {@code willWriteRep} and {@code repWritten} notifications
     * @param charset charset used to encode textual content
     * @param reportIdentical whether untouched files are still reported as written
     */
    public RepresentationWriter(CompilationListener listener, Charset charset, boolean reportIdentical) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
        this.reportIdentical = reportIdentical;
    }

    /**
     * Creates a writer from configuration.
     *
     * @param config compiler configuration
     * @param listener event listener
     * @return configured writer
     */
    public static RepresentationWriter fromConfig(CompilerConfig config, CompilationListener listener) {
        return new RepresentationWriter(listener, config.writer().charset(), config.writer().isReportIdentical());
    }

    /**
     * Writes a snapshot of a representation to the raw path configured for it.
     *
     * @param rep representation to write
     * @param snapshot snapshot to write
     * @return the write outcome, or empty if no raw path is set for the snapshot
     * @throws OutputWriteException if the file cannot be compared or written
     */
    public Optional<WriteResult> write(Representation rep, SnapshotName snapshot) {
        Path rawPath = rep.getRawPaths().get(snapshot);
        if (rawPath == null) {
            log.debug("No output path for snapshot {} of {}; nothing to write", snapshot, rep);
            return Optional.empty();
        }

        listener.willWriteRep(rep, snapshot);

        boolean created = !Files.exists(rawPath);
        boolean modified;
        try {
            if (rep.isBinary()) {
                modified = writeBinary(rep, snapshot, rawPath, created);
            } else {
                modified = writeTextual(rep, rawPath, created);
            }
        } catch (IOException e) {
            throw new OutputWriteException(rawPath, e);
        }

        WriteResult result = new WriteResult(rawPath, snapshot, created, modified);
        log.debug("{} {} (snapshot {})", result.action().label(), rawPath, snapshot);

        if (modified || reportIdentical) {
            listener.repWritten(rep, rawPath, created, modified);
        }
        return Optional.of(result);
    }

    private boolean writeBinary(Representation rep, SnapshotName snapshot, Path rawPath, boolean created)
            throws IOException {
        Path source = rep.getTemporaryFilenames().get(snapshot);
        if (source == null) {
            source = rep.getTemporaryFilenames().get(SnapshotName.LAST);
        }
        if (!created && FileUtils.hasSameContent(rawPath, source)) {
            return false;
        }
        FileUtils.createParentDirectories(rawPath);
        Files.copy(source, rawPath, StandardCopyOption.REPLACE_EXISTING);
        return true;
    }

    private boolean writeTextual(Representation rep, Path rawPath, boolean created) throws IOException {
        byte[] bytes = rep.getContent().get(SnapshotName.LAST).getBytes(charset);
        if (!created && FileUtils.hasSameContent(rawPath, bytes)) {
            return false;
        }
        FileUtils.createParentDirectories(rawPath);
        Files.write(rawPath, bytes);
        return true;
    }
}
