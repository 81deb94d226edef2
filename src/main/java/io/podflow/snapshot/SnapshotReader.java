package io.podflow.snapshot;

import com.google.protobuf.Struct;
import io.podflow.error.PartitionMismatchException;
import io.podflow.snapshot.constant.SnapshotConstant;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the artifacts written by {@link SnapshotWriter}. Reads never modify the
 * snapshot, so they can be repeated any number of times.
 * <p>
 * To read vectors and metadata of the same generation, resolve the manifest once and
 * pass it to both imports. Every artifact header must carry the manifest's generation.
 * </p>
 */
public final class SnapshotReader {

    private SnapshotReader() {
    }

    public static ShardManifest readManifest(final Path dir) throws IOException {
        try (final DataInputStream in = open(dir.resolve(SnapshotConstant.MANIFEST_FILE))) {
            final int magic = in.readInt();
            if (magic != SnapshotConstant.MANIFEST_MAGIC) {
                throw new IOException("Not a snapshot manifest: " + dir);
            }
            readVersion(in, dir);
            final long generation = in.readLong();
            final int shardCount = in.readInt();
            final int total = in.readInt();
            final List<ShardRange> ranges = new ArrayList<>(shardCount);
            for (int i = 0; i < shardCount; i++) {
                ranges.add(new ShardRange(in.readInt(), in.readInt(), in.readInt()));
            }
            return new ShardManifest(generation, shardCount, total, ranges);
        }
    }

    /**
     * Ordered {@code (id, vector)} pairs of one shard.
     *
     * @throws PartitionMismatchException if the shard is outside the manifest or the
     *                                    artifact disagrees with it
     */
    public static List<VectorEntry> importVectors(final Path dir, final int shardIndex) throws IOException {
        return importVectors(dir, readManifest(dir), shardIndex);
    }

    /**
     * Ordered {@code (id, vector)} pairs of one shard of the generation {@code manifest} names.
     */
    public static List<VectorEntry> importVectors(final Path dir,
                                                  final ShardManifest manifest,
                                                  final int shardIndex) throws IOException {
        final ShardRange range = manifest.range(shardIndex);

        try (final DataInputStream in = open(artifact(dir, manifest, SnapshotConstant.vectorsFile(shardIndex)))) {
            final int count = readHeader(in, SnapshotConstant.VECTORS_MAGIC, shardIndex, manifest, range);
            final List<VectorEntry> out = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                final String id = in.readUTF();
                final float[] v = new float[in.readInt()];
                for (int j = 0; j < v.length; j++) {
                    v[j] = in.readFloat();
                }
                out.add(new VectorEntry(id, v));
            }
            return out;
        }
    }

    /**
     * Ordered {@code (id, metadata)} pairs of one shard.
     */
    public static List<MetadataEntry> importMetadata(final Path dir, final int shardIndex) throws IOException {
        return importMetadata(dir, readManifest(dir), shardIndex);
    }

    public static List<MetadataEntry> importMetadata(final Path dir,
                                                     final ShardManifest manifest,
                                                     final int shardIndex) throws IOException {
        final ShardRange range = manifest.range(shardIndex);

        try (final DataInputStream in = open(artifact(dir, manifest, SnapshotConstant.metasFile(shardIndex)))) {
            final int count = readHeader(in, SnapshotConstant.METAS_MAGIC, shardIndex, manifest, range);
            final List<MetadataEntry> out = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                final String id = in.readUTF();
                final byte[] bytes = new byte[in.readInt()];
                in.readFully(bytes);
                out.add(new MetadataEntry(id, Struct.parseFrom(bytes)));
            }
            return out;
        }
    }

    private static int readHeader(final DataInputStream in,
                                  final int expectedMagic,
                                  final int shardIndex,
                                  final ShardManifest manifest,
                                  final ShardRange range) throws IOException {
        if (in.readInt() != expectedMagic) {
            throw new IOException("Unexpected artifact type for shard " + shardIndex);
        }
        readVersion(in, "shard " + shardIndex);
        final long fileGeneration = in.readLong();
        final int fileShard = in.readInt();
        final int fileShardCount = in.readInt();
        final int count = in.readInt();

        if (fileGeneration != manifest.generation()) {
            throw new PartitionMismatchException("artifact for shard " + shardIndex + " belongs to generation "
                    + fileGeneration + " but the manifest names generation " + manifest.generation());
        }
        if (fileShard != shardIndex || fileShardCount != manifest.shardCount()) {
            throw new PartitionMismatchException("artifact for shard " + fileShard + "/" + fileShardCount
                    + " does not belong to manifest shard " + shardIndex + "/" + manifest.shardCount());
        }
        if (count != range.size()) {
            throw new PartitionMismatchException("shard " + shardIndex + " holds " + count
                    + " records but manifest range " + range + " expects " + range.size());
        }
        return count;
    }

    private static void readVersion(final DataInputStream in, final Object source) throws IOException {
        final short version = in.readShort();
        if (version != SnapshotConstant.VERSION) {
            throw new IOException("Unsupported snapshot version " + version + " in " + source);
        }
    }

    private static Path artifact(final Path dir, final ShardManifest manifest, final String fileName) {
        return dir.resolve(SnapshotConstant.generationDir(manifest.generation())).resolve(fileName);
    }

    private static DataInputStream open(final Path file) throws IOException {
        return new DataInputStream(new BufferedInputStream(Files.newInputStream(file)));
    }
}
