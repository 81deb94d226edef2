package io.podflow.snapshot;

import io.podflow.snapshot.constant.SnapshotConstant;
import io.podflow.unit.ScanRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Writes a record stream as a sharded snapshot: per shard a vector artifact and a
 * metadata artifact inside a fresh {@code gen-<n>} directory, then the manifest.
 * <p>
 * Artifacts of a generation are never rewritten. The manifest at the snapshot root is
 * the only file replaced in place, with an atomic move, so switching generations is a
 * single step. A reader that resolved a manifest keeps reading the generation it names.
 * Generations older than {@link SnapshotConstant#RETAINED_GENERATIONS} are removed.
 * </p>
 */
@Slf4j
public final class SnapshotWriter {

    private SnapshotWriter() {
    }

    public static ShardManifest write(final Path dir, final List<ScanRecord> records, final int shardCount) throws IOException {
        Files.createDirectories(dir);
        final Path genDir = createGenerationDir(dir);
        final long generation = SnapshotConstant.parseGeneration(genDir.getFileName().toString());
        final ShardManifest manifest = ShardManifest.of(generation, records.size(), shardCount);

        for (final ShardRange range : manifest.ranges()) {
            final List<ScanRecord> slice = records.subList(range.start(), range.end());
            writeFile(genDir.resolve(SnapshotConstant.vectorsFile(range.shardIndex())),
                    out -> writeVectors(out, generation, range.shardIndex(), shardCount, slice));
            writeFile(genDir.resolve(SnapshotConstant.metasFile(range.shardIndex())),
                    out -> writeMetas(out, generation, range.shardIndex(), shardCount, slice));
        }
        writeAtomically(dir, SnapshotConstant.MANIFEST_FILE, out -> writeManifest(out, manifest));
        pruneGenerations(dir, generation);

        log.info("Wrote snapshot generation {} of {} records across {} shards to {}",
                generation, records.size(), shardCount, dir);
        return manifest;
    }

    private static Path createGenerationDir(final Path dir) throws IOException {
        long next = latestGeneration(dir) + 1;
        while (true) {
            try {
                return Files.createDirectory(dir.resolve(SnapshotConstant.generationDir(next)));
            } catch (final FileAlreadyExistsException e) {
                // another writer claimed it
                next++;
            }
        }
    }

    private static long latestGeneration(final Path dir) throws IOException {
        long latest = 0;
        try (final DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (final Path entry : entries) {
                latest = Math.max(latest, SnapshotConstant.parseGeneration(entry.getFileName().toString()));
            }
        }
        return latest;
    }

    private static void pruneGenerations(final Path dir, final long current) throws IOException {
        final long oldestKept = current - SnapshotConstant.RETAINED_GENERATIONS + 1;
        try (final DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (final Path entry : entries) {
                final long generation = SnapshotConstant.parseGeneration(entry.getFileName().toString());
                if (generation > 0 && generation < oldestKept) {
                    deleteTree(entry);
                    log.debug("Removed snapshot generation {} from {}", generation, dir);
                }
            }
        }
    }

    private static void deleteTree(final Path root) throws IOException {
        try (final Stream<Path> walk = Files.walk(root)) {
            for (final Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(p);
            }
        }
    }

    private static void writeVectors(final DataOutputStream out,
                                     final long generation,
                                     final int shardIndex,
                                     final int shardCount,
                                     final List<ScanRecord> slice) throws IOException {
        writeHeader(out, SnapshotConstant.VECTORS_MAGIC, generation, shardIndex, shardCount, slice.size());
        for (final ScanRecord r : slice) {
            out.writeUTF(r.id());
            final float[] v = r.vector();
            out.writeInt(v.length);
            for (final float f : v) {
                out.writeFloat(f);
            }
        }
    }

    private static void writeMetas(final DataOutputStream out,
                                   final long generation,
                                   final int shardIndex,
                                   final int shardCount,
                                   final List<ScanRecord> slice) throws IOException {
        writeHeader(out, SnapshotConstant.METAS_MAGIC, generation, shardIndex, shardCount, slice.size());
        for (final ScanRecord r : slice) {
            out.writeUTF(r.id());
            final byte[] bytes = r.metadata().toByteArray();
            out.writeInt(bytes.length);
            out.write(bytes);
        }
    }

    private static void writeManifest(final DataOutputStream out, final ShardManifest manifest) throws IOException {
        out.writeInt(SnapshotConstant.MANIFEST_MAGIC);
        out.writeShort(SnapshotConstant.VERSION);
        out.writeLong(manifest.generation());
        out.writeInt(manifest.shardCount());
        out.writeInt(manifest.totalRecords());
        for (final ShardRange r : manifest.ranges()) {
            out.writeInt(r.shardIndex());
            out.writeInt(r.start());
            out.writeInt(r.end());
        }
    }

    private static void writeHeader(final DataOutputStream out,
                                    final int magic,
                                    final long generation,
                                    final int shardIndex,
                                    final int shardCount,
                                    final int count) throws IOException {
        out.writeInt(magic);
        out.writeShort(SnapshotConstant.VERSION);
        out.writeLong(generation);
        out.writeInt(shardIndex);
        out.writeInt(shardCount);
        out.writeInt(count);
    }

    private static void writeFile(final Path file, final Body body) throws IOException {
        try (final DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(file)))) {
            body.write(out);
            out.flush();
        }
    }

    private static void writeAtomically(final Path dir, final String fileName, final Body body) throws IOException {
        final Path tmp = Files.createTempFile(dir, fileName, ".tmp");
        try {
            writeFile(tmp, body);
            Files.move(tmp, dir.resolve(fileName), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @FunctionalInterface
    private interface Body {
        void write(DataOutputStream out) throws IOException;
    }
}
