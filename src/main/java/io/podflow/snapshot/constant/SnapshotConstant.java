package io.podflow.snapshot.constant;

/**
 * File names and header constants of a shard snapshot directory.
 */
public final class SnapshotConstant {
    public static final String MANIFEST_FILE = "manifest.bin";
    public static final String VECTORS_PREFIX = "vectors-";
    public static final String METAS_PREFIX = "metas-";
    public static final String ARTIFACT_EXT = ".bin";
    public static final String GENERATION_PREFIX = "gen-";

    /**
     * Generation directories kept after a dump: the new one and its predecessor, which
     * readers holding the previous manifest may still be reading.
     */
    public static final int RETAINED_GENERATIONS = 2;

    /**
     * 0x50464D46 == 'P' 'F' 'M' 'F'
     */
    public static final int MANIFEST_MAGIC = 0x5046_4D46;

    /**
     * 0x50465643 == 'P' 'F' 'V' 'C'
     */
    public static final int VECTORS_MAGIC = 0x5046_5643;

    /**
     * 0x5046_4D54 == 'P' 'F' 'M' 'T'
     */
    public static final int METAS_MAGIC = 0x5046_4D54;

    public static final short VERSION = 2;

    private SnapshotConstant() {
        // Prevent instantiation
    }

    public static String generationDir(final long generation) {
        return GENERATION_PREFIX + generation;
    }

    /**
     * @return the generation named by {@code dirName}, or {@code -1} if it is not a generation directory
     */
    public static long parseGeneration(final String dirName) {
        if (!dirName.startsWith(GENERATION_PREFIX)) return -1;
        final String digits = dirName.substring(GENERATION_PREFIX.length());
        if (digits.isEmpty() || digits.length() > 18 || !digits.chars().allMatch(Character::isDigit)) return -1;
        return Long.parseLong(digits);
    }

    public static String vectorsFile(final int shardIndex) {
        return VECTORS_PREFIX + shardIndex + ARTIFACT_EXT;
    }

    public static String metasFile(final int shardIndex) {
        return METAS_PREFIX + shardIndex + ARTIFACT_EXT;
    }
}
