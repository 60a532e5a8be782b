package dev.pagestack.util;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-ordered 64-bit id generator used for every persisted CMS row.
 *
 * <pre>
 * | 1 bit sign | 41 bits millis since 2025-01-01 | 10 bits node | 12 bits sequence |
 * </pre>
 *
 * Versions created in the same millisecond on one node still get distinct, increasing ids,
 * so ordering page versions by id matches their creation order.
 */
public final class SnowflakeId {

    private static final long EPOCH_MILLIS = 1735689600000L;

    private static final int NODE_BITS = 10;
    private static final int SEQUENCE_BITS = 12;

    public static final long MAX_NODE_ID = (1L << NODE_BITS) - 1;
    private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;

    private static final int NODE_SHIFT = SEQUENCE_BITS;
    private static final int TIME_SHIFT = SEQUENCE_BITS + NODE_BITS;

    private static final long MAX_BACKWARD_DRIFT_MILLIS = 5;

    private final long nodeId;
    // packed (timestamp << SEQUENCE_BITS) | sequence of the last issued id
    private final AtomicLong lastIssued = new AtomicLong();

    public SnowflakeId(long nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException("Node id must be in [0, " + MAX_NODE_ID + "], got " + nodeId);
        }
        this.nodeId = nodeId;
    }

    /**
     * Issues the next id. Lock-free; concurrent callers race on a single CAS.
     *
     * @throws IllegalStateException when the wall clock moved back further than the tolerated drift
     */
    public long nextId() {
        while (true) {
            long now = System.currentTimeMillis() - EPOCH_MILLIS;
            long previous = lastIssued.get();
            long previousTime = previous >>> SEQUENCE_BITS;
            long previousSequence = previous & SEQUENCE_MASK;

            long time;
            long sequence;
            if (now > previousTime) {
                time = now;
                sequence = 0;
            } else {
                if (previousTime - now > MAX_BACKWARD_DRIFT_MILLIS) {
                    throw new IllegalStateException(
                            "Clock moved backwards by " + (previousTime - now) + "ms, refusing to issue ids");
                }
                time = previousTime;
                sequence = (previousSequence + 1) & SEQUENCE_MASK;
                if (sequence == 0) {
                    // sequence exhausted for this millisecond, borrow the next one
                    time = previousTime + 1;
                }
            }

            long next = (time << SEQUENCE_BITS) | sequence;
            if (lastIssued.compareAndSet(previous, next)) {
                return (time << TIME_SHIFT) | (nodeId << NODE_SHIFT) | sequence;
            }
        }
    }

    public long getNodeId() {
        return nodeId;
    }

    public static Instant creationInstant(long id) {
        return Instant.ofEpochMilli((id >>> TIME_SHIFT) + EPOCH_MILLIS);
    }

    public static int nodeOf(long id) {
        return (int) ((id >>> NODE_SHIFT) & MAX_NODE_ID);
    }

    public static int sequenceOf(long id) {
        return (int) (id & SEQUENCE_MASK);
    }

    @Override
    public String toString() {
        return "SnowflakeId{nodeId=" + nodeId + "}";
    }
}
