package linkguard.core.service.visit;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.jboss.logging.Logger;

import linkguard.core.model.link.VisitRecord;
import linkguard.core.port.out.LinkRepository;
import linkguard.core.port.out.Metrics;

/**
 * Records visits off the request path on a bounded worker pool.
 *
 * <p>Each visit increments the link's counter and appends to the visit log.
 * When the queue is full the visit is dropped, logged and counted rather than
 * slowing down redirects.
 */
public class VisitRecorder {

    private static final Logger LOG = Logger.getLogger(VisitRecorder.class);

    private final LinkRepository repository;
    private final Metrics metrics;
    private final Duration writeTimeout;
    private final ThreadPoolExecutor executor;

    public VisitRecorder(
            LinkRepository repository, Metrics metrics, int workers, int queueCapacity, Duration writeTimeout) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive, got: " + workers);
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queue capacity must be positive, got: " + queueCapacity);
        }
        this.repository = repository;
        this.metrics = metrics;
        this.writeTimeout = writeTimeout;
        final var threadCount = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                workers,
                workers,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    final var thread = new Thread(runnable, "linkguard-visit-" + threadCount.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Queue a visit.
     *
     * @param visit the visit
     * @return true if queued, false if dropped
     */
    public boolean submit(VisitRecord visit) {
        try {
            executor.execute(() -> record(visit));
            return true;
        } catch (RejectedExecutionException e) {
            LOG.warnv("Visit queue saturated, dropping visit to {0}", visit.shortCode());
            if (metrics != null) {
                metrics.recordVisitDropped();
            }
            return false;
        }
    }

    private void record(VisitRecord visit) {
        try {
            repository
                    .incrementVisitCount(visit.shortCode())
                    .chain(() -> repository.saveVisit(visit))
                    .await()
                    .atMost(writeTimeout);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to record visit to {0}", visit.shortCode());
        }
    }

    /**
     * Stop accepting visits and drain the queue.
     *
     * @param timeout how long to wait for queued visits
     */
    public void shutdown(Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warnv("Visit recorder did not drain within {0}, {1} visits abandoned",
                        timeout, executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
