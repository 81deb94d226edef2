package io.podflow.snapshot;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import io.podflow.error.PartitionMismatchException;
import io.podflow.snapshot.constant.SnapshotConstant;
import io.podflow.unit.ScanRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class SnapshotWriterTest {

    @TempDir
    Path tmp;

    private static List<ScanRecord> records(final int n) {
        final List<ScanRecord> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            final Struct meta = Struct.newBuilder()
                    .putFields("text", Value.newBuilder().setStringValue("doc " + i).build())
                    .build();
            out.add(new ScanRecord("d" + i, new float[]{i, i + 0.5f}, meta));
        }
        return out;
    }

    private static ScanRecord record(final String id) {
        return new ScanRecord(id, new float[]{1f}, null);
    }

    private static Path generation(final Path dir, final long generation) {
        return dir.resolve(SnapshotConstant.generationDir(generation));
    }

    @Test
    void writesEveryShardAndReadsItBackInOrder() throws IOException {
        final List<ScanRecord> input = records(7);
        final ShardManifest manifest = SnapshotWriter.write(tmp, input, 3);

        assertEquals(3, manifest.shardCount());
        assertEquals(7, manifest.totalRecords());
        assertTrue(Files.exists(tmp.resolve(SnapshotConstant.MANIFEST_FILE)));

        final List<String> ids = new ArrayList<>();
        for (int s = 0; s < 3; s++) {
            final List<VectorEntry> vectors = SnapshotReader.importVectors(tmp, s);
            final List<MetadataEntry> metas = SnapshotReader.importMetadata(tmp, s);
            assertEquals(manifest.range(s).size(), vectors.size());
            assertEquals(vectors.size(), metas.size());
            for (int i = 0; i < vectors.size(); i++) {
                assertEquals(vectors.get(i).id(), metas.get(i).id());
                ids.add(vectors.get(i).id());
            }
        }
        assertEquals(List.of("d0", "d1", "d2", "d3", "d4", "d5", "d6"), ids);

        final VectorEntry last = SnapshotReader.importVectors(tmp, 2).get(2);
        assertArrayEquals(new float[]{6f, 6.5f}, last.vector());
        assertEquals("doc 6", SnapshotReader.importMetadata(tmp, 2).get(2).metadata()
                .getFieldsMap().get("text").getStringValue());
    }

    @Test
    void readsAreRepeatable() throws IOException {
        SnapshotWriter.write(tmp, records(5), 2);

        final List<VectorEntry> first = SnapshotReader.importVectors(tmp, 1);
        final List<VectorEntry> second = SnapshotReader.importVectors(tmp, 1);
        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).id(), second.get(i).id());
            assertArrayEquals(first.get(i).vector(), second.get(i).vector());
        }
    }

    @Test
    void leavesNoTempFilesBehind() throws IOException {
        final ShardManifest manifest = SnapshotWriter.write(tmp, records(4), 2);
        try (final Stream<Path> files = Files.list(tmp)) {
            assertEquals(2, files.count(), "the manifest and one generation directory");
        }
        try (final Stream<Path> files = Files.list(generation(tmp, manifest.generation()))) {
            assertEquals(4, files.count(), "2 vector and 2 metadata artifacts");
        }
    }

    @Test
    void everyDumpGetsANewGenerationAndOldOnesArePruned() throws IOException {
        assertEquals(1, SnapshotWriter.write(tmp, records(2), 1).generation());
        assertEquals(2, SnapshotWriter.write(tmp, records(3), 1).generation());
        final ShardManifest third = SnapshotWriter.write(tmp, records(4), 1);

        assertEquals(3, third.generation());
        assertEquals(3, SnapshotReader.readManifest(tmp).generation());
        assertFalse(Files.exists(generation(tmp, 1)));
        assertTrue(Files.isDirectory(generation(tmp, 2)));
        assertTrue(Files.isDirectory(generation(tmp, 3)));
    }

    @Test
    void resolvedManifestKeepsReadingItsOwnGeneration() throws IOException {
        SnapshotWriter.write(tmp, List.of(record("x"), record("y")), 1);
        final ShardManifest resolved = SnapshotReader.readManifest(tmp);

        SnapshotWriter.write(tmp, List.of(record("p"), record("q"), record("r")), 1);

        assertEquals(List.of("x", "y"), SnapshotReader.importVectors(tmp, resolved, 0).stream()
                .map(VectorEntry::id).toList());
        assertEquals(List.of("x", "y"), SnapshotReader.importMetadata(tmp, resolved, 0).stream()
                .map(MetadataEntry::id).toList());
        assertEquals(List.of("p", "q", "r"), SnapshotReader.importMetadata(tmp, 0).stream()
                .map(MetadataEntry::id).toList());
    }

    @Test
    void artifactsOfDifferentGenerationsAreNeverPaired() throws IOException {
        final ShardManifest first = SnapshotWriter.write(tmp, List.of(record("x"), record("y")), 1);
        final ShardManifest second = SnapshotWriter.write(tmp, List.of(record("p"), record("q")), 1);

        Files.copy(generation(tmp, first.generation()).resolve(SnapshotConstant.metasFile(0)),
                generation(tmp, second.generation()).resolve(SnapshotConstant.metasFile(0)),
                StandardCopyOption.REPLACE_EXISTING);

        assertEquals(List.of("p", "q"), SnapshotReader.importVectors(tmp, 0).stream()
                .map(VectorEntry::id).toList());
        assertThrows(PartitionMismatchException.class, () -> SnapshotReader.importMetadata(tmp, 0));
    }

    @Test
    void emptyStreamStillProducesAManifest() throws IOException {
        final ShardManifest manifest = SnapshotWriter.write(tmp, List.of(), 2);
        assertEquals(0, manifest.totalRecords());
        assertTrue(SnapshotReader.importVectors(tmp, 0).isEmpty());
        assertTrue(SnapshotReader.importMetadata(tmp, 1).isEmpty());
    }

    @Test
    void shardOutsideManifestIsAPartitionMismatch() throws IOException {
        SnapshotWriter.write(tmp, records(6), 2);
        assertThrows(PartitionMismatchException.class, () -> SnapshotReader.importVectors(tmp, 2));
        assertThrows(PartitionMismatchException.class, () -> SnapshotReader.importMetadata(tmp, -1));
    }

    @Test
    void artifactCutForAnotherShardCountIsAPartitionMismatch(@TempDir final Path other) throws IOException {
        SnapshotWriter.write(tmp, records(6), 2);
        SnapshotWriter.write(other, records(6), 3);

        Files.copy(generation(other, 1).resolve(SnapshotConstant.vectorsFile(1)),
                generation(tmp, 1).resolve(SnapshotConstant.vectorsFile(1)),
                StandardCopyOption.REPLACE_EXISTING);

        assertThrows(PartitionMismatchException.class, () -> SnapshotReader.importVectors(tmp, 1));
        assertEquals(3, SnapshotReader.importMetadata(tmp, 1).size());
    }
}
