package io.podflow.snapshot.merge;

import io.podflow.core.model.Document;
import io.podflow.core.model.Match;
import io.podflow.core.model.Request;
import io.podflow.core.model.Response;
import io.podflow.core.model.UnitFailure;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Merges independently ranked per-shard answers into one ranking.
 * <p>
 * Sorting is stable over the shard-ordered concatenation, so equal scores keep
 * shard order first and each shard's local order second.
 * </p>
 * <p>
 * Writes reach every shard, so the same entry can be reported by several shards.
 * Each id appears once in the result, at its best-ranked position.
 * </p>
 */
public final class MatchMerger {
    private static final Comparator<Match> BY_SCORE_DESC =
            Comparator.comparingDouble(Match::score).reversed();

    private final MergePolicy policy;

    public MatchMerger(final MergePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @param perShard match lists in shard order, each already ranked locally
     * @param topK     caller's requested size; {@code <= 0} means unbounded
     */
    public List<Match> merge(final List<List<Match>> perShard, final int topK) {
        final List<Match> all = new ArrayList<>();
        for (final List<Match> shard : perShard) {
            all.addAll(shard);
        }
        all.sort(BY_SCORE_DESC);

        final Set<String> seen = new HashSet<>();
        final List<Match> unique = new ArrayList<>(all.size());
        for (final Match m : all) {
            if (seen.add(m.id())) {
                unique.add(m);
            }
        }

        if (policy == MergePolicy.TRUNCATE_TO_TOP_K && topK > 0 && unique.size() > topK) {
            return List.copyOf(unique.subList(0, topK));
        }
        return List.copyOf(unique);
    }

    /**
     * Merges whole shard responses document by document. The query documents of the
     * first response are kept; their matches are replaced by the merged ranking.
     */
    public Response merge(final Request request, final List<Response> shardResponses) {
        if (shardResponses.isEmpty()) {
            return Response.of(request, request.docs());
        }

        final List<Document> base = shardResponses.get(0).docs();
        final List<Document> merged = new ArrayList<>(base.size());
        final List<UnitFailure> failures = new ArrayList<>();

        for (int d = 0; d < base.size(); d++) {
            final List<List<Match>> perShard = new ArrayList<>(shardResponses.size());
            for (final Response r : shardResponses) {
                if (d < r.docs().size()) {
                    perShard.add(r.docs().get(d).matches());
                }
            }
            merged.add(base.get(d).withMatches(merge(perShard, request.topK())));
        }
        for (final Response r : shardResponses) {
            failures.addAll(r.failures());
        }

        return new Response(request.requestId(), request.type(), merged, failures);
    }
}
