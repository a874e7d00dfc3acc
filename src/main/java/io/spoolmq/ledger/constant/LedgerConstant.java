package io.spoolmq.ledger.constant;

/**
 * Shared constants for ledger segment files.
 */
public final class LedgerConstant {
    /**
     * File extension for segment files.
     */
    public static final String SEGMENT_EXT = ".seg";

    /**
     * File extension for sparse offset index files.
     */
    public static final String INDEX_EXT = ".idx";

    /**
     * Segment files are named after their zero-padded base offset so lexical order is offset order.
     */
    public static final int FILE_NAME_DIGITS = 20;

    /**
     * [len:int32][crc32c:int32] prefix in front of every record payload.
     */
    public static final int RECORD_OVERHEAD = Integer.BYTES + Integer.BYTES;

    /**
     * (offset:uint64, bytePosition:uint64) per sparse index entry.
     */
    public static final int INDEX_ENTRY_SIZE = Long.BYTES + Long.BYTES;

    public static final long NO_TIMESTAMP = -1L;

    private LedgerConstant() {
        // Prevent instantiation
    }

    public static String fileName(final long baseOffset, final String ext) {
        return String.format("%0" + FILE_NAME_DIGITS + "d%s", baseOffset, ext);
    }
}
