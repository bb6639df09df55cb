package linkguard.core.service.link;

import java.time.Clock;

/**
 * 63-bit Snowflake ID generator, Base62-encoded into short codes.
 *
 * <p>Layout: 41 bits of milliseconds since 2010-11-04T01:42:54.657Z, 10 bits of
 * node ID ({@code datacenterId << 5 | workerId}) and a 12-bit per-millisecond
 * sequence. IDs from one generator are strictly increasing; if the clock moves
 * backwards the generator keeps issuing from the last timestamp it saw.
 */
public class SnowflakeIdGenerator implements ShortCodeGenerator {

    static final long EPOCH_MILLIS = 1288834974657L;

    private static final int NODE_BITS = 10;
    private static final int SEQUENCE_BITS = 12;
    private static final long MAX_PART_ID = 31;
    private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;

    private final Clock clock;
    private final long nodeId;

    private long lastTimestamp = -1L;
    private long sequence = 0L;

    public SnowflakeIdGenerator(long datacenterId, long workerId, Clock clock) {
        if (datacenterId < 0 || datacenterId > MAX_PART_ID) {
            throw new IllegalArgumentException("datacenter ID must be in 0..31, got: " + datacenterId);
        }
        if (workerId < 0 || workerId > MAX_PART_ID) {
            throw new IllegalArgumentException("worker ID must be in 0..31, got: " + workerId);
        }
        this.nodeId = (datacenterId << 5) | workerId;
        this.clock = clock;
    }

    /**
     * Generate the next ID.
     *
     * @return a positive, unique ID
     */
    public synchronized long nextId() {
        var timestamp = Math.max(clock.millis() - EPOCH_MILLIS, lastTimestamp);
        if (timestamp == lastTimestamp) {
            sequence = (sequence + 1) & SEQUENCE_MASK;
            if (sequence == 0) {
                // sequence exhausted for this millisecond, borrow the next one
                timestamp = lastTimestamp + 1;
            }
        } else {
            sequence = 0;
        }
        lastTimestamp = timestamp;
        return (timestamp << (NODE_BITS + SEQUENCE_BITS)) | (nodeId << SEQUENCE_BITS) | sequence;
    }

    @Override
    public String nextCode() {
        return Base62.encode(nextId());
    }

    public long nodeId() {
        return nodeId;
    }
}
