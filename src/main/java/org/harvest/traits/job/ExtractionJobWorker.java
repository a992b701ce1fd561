package org.harvest.traits.job;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.harvest.traits.profile.TraitExtractionConfig;
import org.jboss.logging.Logger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Background pool executing submitted extraction jobs in FIFO order.
 *
 * <p>Sized by {@code trait-extraction.worker.pool-size}. With the default of
 * one thread, jobs run strictly one after another.
 */
@ApplicationScoped
public class ExtractionJobWorker {

    private static final Logger LOG = Logger.getLogger(ExtractionJobWorker.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ExecutorService executor;

    /**
     * Default constructor for CDI proxy.
     */
    public ExtractionJobWorker() {
        this.executor = null;
    }

    @Inject
    public ExtractionJobWorker(TraitExtractionConfig config) {
        this(config.worker().poolSize());
    }

    public ExtractionJobWorker(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Worker pool size must be positive: " + poolSize);
        }
        this.executor = Executors.newFixedThreadPool(poolSize, namedThreads());
        LOG.infof("Extraction worker started with %d thread(s)", poolSize);
    }

    /**
     * Queues a job for execution.
     *
     * @param jobId job being executed, for logging
     * @param task work to run
     * @return future completing when the task has run
     */
    public Future<?> submit(long jobId, Runnable task) {
        LOG.debugf("Queued extraction job %d", jobId);
        return executor.submit(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.errorf(e, "Extraction job %d terminated unexpectedly", jobId);
                throw e;
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warnf("Extraction worker did not stop within %d seconds, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads() {
        final AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            final Thread thread = new Thread(runnable, "extraction-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
