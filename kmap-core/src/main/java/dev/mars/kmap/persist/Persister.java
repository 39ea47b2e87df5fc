/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.kmap.persist;

import dev.mars.kmap.codec.BinaryReader;
import dev.mars.kmap.codec.BinaryWriter;
import dev.mars.kmap.codec.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipException;

/**
 * Drives snapshot save and load for a {@link Persistable}.
 * <p>
 * <b>Save:</b> the image is encoded into an in-memory buffer (through gzip
 * when requested), written to a temp file next to the destination, optionally
 * fsynced, then atomically renamed over the destination and the directory is
 * fsynced. A reader of the destination path sees either the previous file or
 * the complete new one.
 * <p>
 * <b>Load:</b> the whole file is read into memory; if it starts with the gzip
 * signature {@code 1f 8b} it is inflated first, then handed to the target.
 * <p>
 * <b>Async:</b> {@link #saveAsync} and {@link #loadAsync} run the same work on
 * a background executor. The target's lock is only taken for the part that
 * touches the structure, never for the lifetime of the task.
 */
public final class Persister {

    private static final Logger LOG = LoggerFactory.getLogger(Persister.class);

    private static final int GZIP_MAGIC_0 = 0x1f;
    private static final int GZIP_MAGIC_1 = 0x8b;

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    /** Shared daemon pool for background snapshots. */
    private static final ExecutorService DEFAULT_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "kmap-persist-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final boolean syncEnabled;
    private final Executor executor;

    /** fsync enabled, default background executor. */
    public Persister() {
        this(true);
    }

    public Persister(boolean syncEnabled) {
        this(syncEnabled, DEFAULT_EXECUTOR);
    }

    /**
     * @param syncEnabled if false, fsync of the file and its directory is skipped
     * @param executor    runs {@link #saveAsync}/{@link #loadAsync}
     */
    public Persister(boolean syncEnabled, Executor executor) {
        this.syncEnabled = syncEnabled;
        this.executor = executor;
        if (!syncEnabled) {
            LOG.debug("Persister created with fsync disabled");
        }
    }

    public boolean syncEnabled() {
        return syncEnabled;
    }

    // ========================================================================
    // Save
    // ========================================================================

    /**
     * Writes a snapshot of {@code source} to {@code path}, creating parent directories.
     *
     * @throws IOException on any filesystem failure, unchanged
     */
    public void save(Persistable source, Path path, SaveOptions options) throws IOException {
        long startNanos = System.nanoTime();
        Path target = path.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        long entries = encode(source, buffer, options);
        byte[] image = buffer.toByteArray();

        writeAtomically(target, image);

        LOG.info("Snapshot saved: path={}, entries={}, bytes={}, compressed={}, {} ms",
                target, entries, image.length, options.compress(),
                (System.nanoTime() - startNanos) / 1_000_000);
    }

    /** Runs {@link #save} in the background. */
    public PersistenceTask saveAsync(Persistable source, Path path, SaveOptions options) {
        LOG.debug("Scheduling background save to {}", path);
        return PersistenceTask.start("save", path, () -> save(source, path, options), executor);
    }

    private static long encode(Persistable source, OutputStream buffer, SaveOptions options) throws IOException {
        if (!options.compress()) {
            return source.writeImage(new BinaryWriter(buffer));
        }
        int level = options.effectiveLevel();
        try (OutputStream gzip = new BufferedOutputStream(new LeveledGzipOutputStream(buffer, level))) {
            BinaryWriter writer = new BinaryWriter(gzip);
            long entries = source.writeImage(writer);
            writer.flush();
            return entries;
        }
    }

    /**
     * Write temp, fsync, rename over the destination, fsync the directory.
     */
    private void writeAtomically(Path target, byte[] image) throws IOException {
        Path dir = target.getParent();
        Path tmpPath = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
        try {
            try (FileChannel ch = FileChannel.open(tmpPath,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(image);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    ch.force(true);
                    LOG.trace("Synced temp snapshot file {}", tmpPath);
                }
            }

            try {
                Files.move(tmpPath, target,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.warn("Atomic rename not supported for {}, falling back to plain replace", target);
                Files.move(tmpPath, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.trace("Rename: {} -> {}", tmpPath, target);

            if (syncEnabled && dir != null) {
                syncDirectory(dir);
            }
        } finally {
            Files.deleteIfExists(tmpPath);
        }
    }

    /**
     * Fsyncs a directory so the rename itself is durable.
     * <p>
     * On Windows, this may fail or be a no-op. That's acceptable for development.
     */
    private void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some systems don't support directory fsync - log but continue
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    // ========================================================================
    // Load
    // ========================================================================

    /**
     * Replaces the contents of {@code target} with the snapshot at {@code path}.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws FormatException                   if the file is not a valid snapshot
     */
    public void load(Persistable target, Path path) throws IOException {
        long startNanos = System.nanoTime();
        byte[] data = Files.readAllBytes(path);
        boolean compressed = isGzip(data);
        byte[] image = compressed ? inflate(data, path) : data;

        long entries = target.readImage(new BinaryReader(new ByteArrayInputStream(image)));

        LOG.info("Snapshot loaded: path={}, entries={}, bytes={}, compressed={}, {} ms",
                path, entries, data.length, compressed,
                (System.nanoTime() - startNanos) / 1_000_000);
    }

    /** Runs {@link #load} in the background. */
    public PersistenceTask loadAsync(Persistable target, Path path) {
        LOG.debug("Scheduling background load from {}", path);
        return PersistenceTask.start("load", path, () -> load(target, path), executor);
    }

    /** True if {@code data} starts with the gzip signature. */
    static boolean isGzip(byte[] data) {
        return data.length >= 2
                && (data[0] & 0xFF) == GZIP_MAGIC_0
                && (data[1] & 0xFF) == GZIP_MAGIC_1;
    }

    private static byte[] inflate(byte[] data, Path path) throws IOException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        } catch (ZipException | EOFException e) {
            throw new FormatException("Corrupt compressed snapshot: " + path, e);
        }
    }

    /** {@link GZIPOutputStream} with a configurable deflate level. */
    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
