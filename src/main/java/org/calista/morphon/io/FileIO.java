package org.calista.morphon.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * FileIO — единая точка I/O движка: snapshot-in, reports-out.
 *
 * <p>Inputs (corpus snapshots, table overrides, config) are read from anywhere or
 * from the classpath. Outputs go into {@code baseDir} only; {@link #resolve(String)}
 * refuses to leave it. Reports are written through a {@link WriterHandle} and land
 * on disk only on {@link #commit(WriterHandle)}.
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private static final String TMP_SUFFIX = ".tmp";

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create base directory " + this.baseDir, e);
        }
        log.debug("FileIO ready: baseDir={}, charset={}, atomicWrites={}", this.baseDir, charset, atomicWrites);
    }

    public Path baseDir() { return baseDir; }

    public Charset charset() { return charset; }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    // Paths

    /** Output path inside baseDir; absolute paths and ".." escapes are rejected. */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Path.of(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("Expected a relative path: " + relative);
        Path p = baseDir.resolve(rel).normalize();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path escapes " + baseDir + ": " + relative);
        return p;
    }

    /** Input path, anywhere on disk. */
    public Path resolveExternal(String anyPath) {
        return Path.of(Objects.requireNonNull(anyPath, "anyPath")).toAbsolutePath().normalize();
    }

    public boolean exists(Path file) {
        return Files.exists(Objects.requireNonNull(file, "file"));
    }

    // Read

    public String readString(Path file) throws IOException {
        return Files.readString(Objects.requireNonNull(file, "file"), charset);
    }

    /**
     * Bundled classpath resource (default tables, sample corpus).
     *
     * @throws NoSuchFileException when it is not on the classpath
     */
    public String readResource(String resource) throws IOException {
        try (InputStream in = openResource(resource)) {
            return new String(in.readAllBytes(), charset);
        }
    }

    /** Non-blank, trimmed lines of a JSONL classpath resource. */
    public List<String> readResourceJsonl(String resource) throws IOException {
        try (BufferedReader r = new BufferedReader(new InputStreamReader(openResource(resource), charset))) {
            return jsonlLines(r);
        }
    }

    /** Non-blank, trimmed lines of a JSONL file. */
    public List<String> readJsonl(Path file) throws IOException {
        try (BufferedReader r = Files.newBufferedReader(Objects.requireNonNull(file, "file"), charset)) {
            List<String> out = jsonlLines(r);
            log.debug("readJsonl: {} ({} lines)", file, out.size());
            return out;
        }
    }

    private static List<String> jsonlLines(BufferedReader r) throws IOException {
        List<String> out = new ArrayList<>();
        for (String line = r.readLine(); line != null; line = r.readLine()) {
            String t = line.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static InputStream openResource(String resource) throws NoSuchFileException {
        Objects.requireNonNull(resource, "resource");
        String name = resource.startsWith("/") ? resource : "/" + resource;
        InputStream in = FileIO.class.getResourceAsStream(name);
        if (in == null) throw new NoSuchFileException("classpath:" + name);
        return in;
    }

    // Write

    /** Whole-file write, committed the same way as a report. */
    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(content, "content");
        WriterHandle h = openWriter(file);
        try {
            h.writer.write(content);
            commit(h);
        } catch (IOException | RuntimeException e) {
            rollback(h, e);
            throw e;
        }
    }

    /** Journal append: one trimmed line, never through a temp file. */
    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(file, "file");
        String s = Objects.requireNonNull(jsonLine, "jsonLine").trim();
        if (s.isEmpty()) return;
        createParent(file);
        Files.writeString(file, s + System.lineSeparator(), charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    /** Opens a report writer. With atomic writes the content goes to a sibling temp file first. */
    public WriterHandle openWriter(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        createParent(file);
        Path target = atomicWrites ? file.resolveSibling(file.getFileName() + TMP_SUFFIX) : file;
        BufferedWriter w = Files.newBufferedWriter(target, charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return new WriterHandle(file, atomicWrites ? target : null, w);
    }

    public void commit(WriterHandle h) throws IOException {
        Objects.requireNonNull(h, "handle");
        h.writer.close();
        if (h.tmpFile == null) return;
        try {
            Files.move(h.tmpFile, h.targetFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.trace("Atomic move unsupported for {}, plain replace", h.targetFile);
            Files.move(h.tmpFile, h.targetFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Drops an uncommitted writer. Cleanup failures are attached to {@code cause}
     * as suppressed exceptions; the caller rethrows the cause.
     */
    public void rollback(WriterHandle h, Throwable cause) {
        if (h == null) return;
        try {
            h.writer.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
        if (h.tmpFile != null) {
            try {
                Files.deleteIfExists(h.tmpFile);
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
        log.debug("Rolled back write of {}", h.targetFile);
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    /** Open report writer; {@code tmpFile} is null without atomic writes. */
    public static final class WriterHandle {
        public final Path targetFile;
        public final Path tmpFile;
        public final BufferedWriter writer;

        private WriterHandle(Path targetFile, Path tmpFile, BufferedWriter writer) {
            this.targetFile = targetFile;
            this.tmpFile = tmpFile;
            this.writer = writer;
        }
    }
}
