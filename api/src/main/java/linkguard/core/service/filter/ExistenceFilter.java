package linkguard.core.service.filter;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import org.jboss.logging.Logger;

/**
 * Thread-safe Bloom filter answering "definitely absent" for short codes.
 *
 * <p>Uses Guava's BloomFilter sized from a capacity and a target false positive
 * probability. There are no false negatives: once a key is added,
 * {@link #mightContain} returns true for it until {@link #clear()}. Adding more
 * keys than the capacity raises the false positive rate but never fails.
 *
 * <p>Readers share a read lock and run in parallel; {@link #add},
 * {@link #addBatch} and {@link #clear} take the write lock.
 */
public class ExistenceFilter {

    private static final Logger LOG = Logger.getLogger(ExistenceFilter.class);

    private final long capacity;
    private final double falsePositiveRate;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private BloomFilter<CharSequence> filter;
    private volatile boolean initialized = false;

    /**
     * Create an empty filter.
     *
     * @param capacity expected number of keys, must be positive
     * @param falsePositiveRate target false positive probability, in (0, 1)
     * @throws IllegalArgumentException if either parameter is out of range
     */
    public ExistenceFilter(long capacity, double falsePositiveRate) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        if (!(falsePositiveRate > 0.0 && falsePositiveRate < 1.0)) {
            throw new IllegalArgumentException("false positive rate must be in (0, 1), got: " + falsePositiveRate);
        }
        this.capacity = capacity;
        this.falsePositiveRate = falsePositiveRate;
        this.filter = createFilter();
        LOG.infof("Created existence filter (capacity: %d, fpp: %.4f)", capacity, falsePositiveRate);
    }

    private BloomFilter<CharSequence> createFilter() {
        return BloomFilter.create(Funnels.stringFunnel(StandardCharsets.UTF_8), capacity, falsePositiveRate);
    }

    public void add(String key) {
        lock.writeLock().lock();
        try {
            filter.put(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Add many keys under a single write lock acquisition.
     *
     * @param keys the keys
     */
    public void addBatch(Iterable<String> keys) {
        lock.writeLock().lock();
        try {
            for (final var key : keys) {
                filter.put(key);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Test membership.
     *
     * @param key the key
     * @return false only if the key was never added
     */
    public boolean mightContain(String key) {
        lock.readLock().lock();
        try {
            return filter.mightContain(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drop every key by swapping in an empty filter.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            filter = createFilter();
            initialized = false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long approximateElementCount() {
        lock.readLock().lock();
        try {
            return filter.approximateElementCount();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The false positive probability at the current fill level.
     *
     * @return the expected fpp
     */
    public double expectedFpp() {
        lock.readLock().lock();
        try {
            return filter.expectedFpp();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Mark the filter as loaded from the durable store.
     */
    public void markInitialized() {
        initialized = true;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public long capacity() {
        return capacity;
    }

    public double falsePositiveRate() {
        return falsePositiveRate;
    }
}
