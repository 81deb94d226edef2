package io.podflow.snapshot;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Range partitioning of an ordered record stream. Shard {@code s} of {@code S} owns
 * {@code [s * floor(N/S), (s+1) * floor(N/S))}; the last shard also takes the
 * {@code N mod S} remainder and always ends at {@code N}.
 */
@UtilityClass
public class ShardPartitioner {

    public List<ShardRange> ranges(final int totalRecords, final int shardCount) {
        checkArgs(totalRecords, shardCount);
        final List<ShardRange> out = new ArrayList<>(shardCount);
        for (int s = 0; s < shardCount; s++) {
            out.add(rangeFor(totalRecords, shardCount, s));
        }
        return out;
    }

    public ShardRange rangeFor(final int totalRecords, final int shardCount, final int shardIndex) {
        checkArgs(totalRecords, shardCount);
        if (shardIndex < 0 || shardIndex >= shardCount) {
            throw new IllegalArgumentException("shardIndex " + shardIndex + " outside [0, " + shardCount + ")");
        }
        final int size = totalRecords / shardCount;
        final int start = shardIndex * size;
        final int end = (shardIndex == shardCount - 1) ? totalRecords : (shardIndex + 1) * size;
        return new ShardRange(shardIndex, start, end);
    }

    /**
     * Slices {@code records} by {@link #ranges(int, int)}; concatenating the result in
     * shard order gives back {@code records}.
     */
    public <T> List<List<T>> partition(final List<T> records, final int shardCount) {
        final List<List<T>> out = new ArrayList<>(shardCount);
        for (final ShardRange r : ranges(records.size(), shardCount)) {
            out.add(List.copyOf(records.subList(r.start(), r.end())));
        }
        return out;
    }

    private void checkArgs(final int totalRecords, final int shardCount) {
        if (shardCount < 1) throw new IllegalArgumentException("shardCount must be >= 1");
        if (totalRecords < 0) throw new IllegalArgumentException("totalRecords must be >= 0");
    }
}
