package io.podflow.unit.builtin;

import io.podflow.core.model.Document;
import io.podflow.core.model.Match;
import io.podflow.core.model.Request;
import io.podflow.core.model.Response;
import io.podflow.error.PartitionMismatchException;
import io.podflow.snapshot.MetadataEntry;
import io.podflow.snapshot.ShardManifest;
import io.podflow.snapshot.SnapshotReader;
import io.podflow.snapshot.VectorEntry;
import io.podflow.unit.ProcessingUnit;
import io.podflow.unit.ScanRecord;
import io.podflow.unit.UnitContext;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps indexed documents in insertion order and answers searches with a dot-product
 * ranking. With a {@code dumpPath} parameter the unit loads its own shard's slice of a
 * snapshot on {@link #open()}.
 */
@Slf4j
public final class InMemoryIndexer implements ProcessingUnit {
    public static final String DUMP_PATH = "dumpPath";

    private final UnitContext context;
    private final Map<String, Document> docs = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryIndexer(final UnitContext context) {
        this.context = context;
    }

    @Override
    public void open() throws Exception {
        if (context.workspace() != null) {
            Files.createDirectories(context.workspace());
        }

        final String dumpPath = context.param(DUMP_PATH);
        if (dumpPath == null) return;

        final Path dir = Paths.get(dumpPath);
        final ShardManifest manifest = SnapshotReader.readManifest(dir);
        if (manifest.shardCount() != context.shardCount()) {
            throw new PartitionMismatchException("snapshot at " + dir + " has " + manifest.shardCount()
                    + " shards but " + context.podName() + " runs " + context.shardCount());
        }

        final List<VectorEntry> vectors = SnapshotReader.importVectors(dir, manifest, context.shardIndex());
        final List<MetadataEntry> metas = SnapshotReader.importMetadata(dir, manifest, context.shardIndex());
        if (vectors.size() != metas.size()) {
            throw new PartitionMismatchException("shard " + context.shardIndex() + " of " + dir + " has "
                    + vectors.size() + " vectors but " + metas.size() + " metadata entries");
        }

        final List<Document> loaded = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            final VectorEntry v = vectors.get(i);
            final MetadataEntry m = metas.get(i);
            if (!v.id().equals(m.id())) {
                throw new PartitionMismatchException("shard " + context.shardIndex() + " of " + dir
                        + " pairs vector " + v.id() + " with metadata " + m.id() + " at position " + i);
            }
            loaded.add(Document.of(v.id(), v.vector(), m.metadata()));
        }

        lock.writeLock().lock();
        try {
            docs.clear();
            for (final Document d : loaded) {
                docs.put(d.id(), d);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("{} replica {} shard {} loaded {} records from {}",
                context.podName(), context.replicaIndex(), context.shardIndex(), vectors.size(), dir);
    }

    @Override
    public Response process(final Request request) {
        return switch (request.type()) {
            case INDEX -> index(request);
            case SEARCH -> search(request);
        };
    }

    private Response index(final Request request) {
        lock.writeLock().lock();
        try {
            for (final Document d : request.docs()) {
                docs.put(d.id(), d.withMatches(List.of()));
            }
        } finally {
            lock.writeLock().unlock();
        }
        return Response.of(request, request.docs());
    }

    private Response search(final Request request) {
        final List<Document> out = new ArrayList<>(request.docs().size());
        lock.readLock().lock();
        try {
            for (final Document query : request.docs()) {
                out.add(query.withMatches(rank(query, request.topK())));
            }
        } finally {
            lock.readLock().unlock();
        }
        return Response.of(request, out);
    }

    private List<Match> rank(final Document query, final int topK) {
        if (!query.hasEmbedding()) return List.of();

        final List<Match> matches = new ArrayList<>();
        for (final Document candidate : docs.values()) {
            if (!candidate.hasEmbedding()) continue;
            matches.add(new Match(candidate, dot(query.embedding(), candidate.embedding())));
        }
        matches.sort(Comparator.comparingDouble(Match::score).reversed());
        return topK > 0 && matches.size() > topK ? List.copyOf(matches.subList(0, topK)) : matches;
    }

    private static double dot(final float[] a, final float[] b) {
        final int n = Math.min(a.length, b.length);
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    @Override
    public List<ScanRecord> fullScan() {
        lock.readLock().lock();
        try {
            final List<ScanRecord> out = new ArrayList<>(docs.size());
            for (final Document d : docs.values()) {
                out.add(new ScanRecord(d.id(), d.embedding(), d.metadata()));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return docs.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
