package dev.yeying.interviewer.util;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-ordered 64-bit identifier generator used for resume nodes and content records.
 *
 * <pre>
 * | 1 bit (unused) | 41 bits (millis since 2024-01-01) | 10 bits (node id) | 12 bits (sequence) |
 * </pre>
 *
 * <p>Identifiers are never reused, so a deleted node's id cannot be reassigned to a new node.</p>
 */
public final class SnowflakeId {

    // 2024-01-01T00:00:00Z
    private static final long EPOCH_MILLIS = 1704067200000L;

    private static final int NODE_BITS = 10;
    private static final int SEQUENCE_BITS = 12;
    private static final long MAX_NODE = (1L << NODE_BITS) - 1;
    private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;
    private static final int NODE_SHIFT = SEQUENCE_BITS;
    private static final int TIME_SHIFT = SEQUENCE_BITS + NODE_BITS;

    /** Backwards clock movement tolerated before generation is refused, in millis. */
    private static final long MAX_DRIFT_MILLIS = 5;

    private final long node;
    // packed (elapsedMillis << SEQUENCE_BITS) | sequence of the last issued id
    private final AtomicLong state = new AtomicLong();

    public SnowflakeId(long node) {
        if (node < 0 || node > MAX_NODE) {
            throw new IllegalArgumentException("Node id must be within [0, " + MAX_NODE + "], got: " + node);
        }
        this.node = node;
    }

    /**
     * Issues the next identifier. Lock-free; safe for concurrent callers.
     *
     * @throws IllegalStateException if the wall clock went back further than the tolerated drift
     */
    public long nextId() {
        while (true) {
            long now = elapsedMillis();
            long previous = state.get();
            long previousMillis = previous >>> SEQUENCE_BITS;
            long previousSequence = previous & SEQUENCE_MASK;

            long millis;
            long sequence;
            if (now > previousMillis) {
                millis = now;
                sequence = 0;
            } else if (previousMillis - now <= MAX_DRIFT_MILLIS) {
                sequence = (previousSequence + 1) & SEQUENCE_MASK;
                // sequence exhausted for this millisecond
                millis = sequence == 0 ? awaitMillisAfter(previousMillis) : previousMillis;
            } else {
                throw new IllegalStateException(
                        "Clock moved backwards by " + (previousMillis - now) + "ms, refusing to issue ids");
            }

            if (state.compareAndSet(previous, (millis << SEQUENCE_BITS) | sequence)) {
                return (millis << TIME_SHIFT) | (node << NODE_SHIFT) | sequence;
            }
        }
    }

    public static Instant issuedAt(long id) {
        return Instant.ofEpochMilli((id >>> TIME_SHIFT) + EPOCH_MILLIS);
    }

    public static int nodeOf(long id) {
        return (int) ((id >>> NODE_SHIFT) & MAX_NODE);
    }

    public static int sequenceOf(long id) {
        return (int) (id & SEQUENCE_MASK);
    }

    private static long awaitMillisAfter(long millis) {
        long now = elapsedMillis();
        while (now <= millis) {
            Thread.onSpinWait();
            now = elapsedMillis();
        }
        return now;
    }

    private static long elapsedMillis() {
        return System.currentTimeMillis() - EPOCH_MILLIS;
    }

    @Override
    public String toString() {
        return "SnowflakeId{node=" + node + "}";
    }
}
