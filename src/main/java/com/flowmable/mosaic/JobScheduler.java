package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool with batch barriers.
 * <p>
 * Work is submitted to a {@link Batch}; {@link Batch#awaitAll()} blocks until
 * every unit submitted to that batch so far has finished, successfully or not.
 * Units submitted after the barrier has started belong to the next batch.
 * Independent batches share the same workers, which lets two pipeline stages
 * run side by side while each waits only on its own work.
 * <p>
 * No ordering is guaranteed between units: each unit must write to its own
 * indexed slot. A failing unit is logged and counted; it never cancels its
 * siblings.
 */
public class JobScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    /** Workers per available processor when no explicit size is configured. */
    private static final int THREADS_PER_PROCESSOR = 2;

    private final ExecutorService executor;
    private final int workerCount;
    private final Batch defaultBatch;

    public JobScheduler() {
        this(defaultWorkerCount());
    }

    public JobScheduler(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        this.workerCount = workerCount;
        this.executor = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
        this.defaultBatch = new Batch();
    }

    public static int defaultWorkerCount() {
        return THREADS_PER_PROCESSOR * Runtime.getRuntime().availableProcessors();
    }

    public int workerCount() {
        return workerCount;
    }

    /**
     * Submit a unit of work to the default batch.
     */
    public void submit(Runnable unit) {
        defaultBatch.submit(unit);
    }

    /**
     * Block until every unit of the default batch has finished.
     *
     * @return number of units that failed
     */
    public int awaitAll() {
        return defaultBatch.awaitAll();
    }

    /**
     * Create a batch with its own barrier, executed on this scheduler's workers.
     */
    public Batch newBatch() {
        return new Batch();
    }

    /**
     * Stop accepting work, let queued units finish and terminate the workers.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.info("Waiting for {} worker(s) to drain", workerCount);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * A group of units sharing one completion barrier.
     */
    public final class Batch {

        private final Object lock = new Object();
        private List<Future<?>> pending = new ArrayList<>();

        private Batch() {}

        public void submit(Runnable unit) {
            Future<?> future = executor.submit(unit);
            synchronized (lock) {
                pending.add(future);
            }
        }

        /**
         * Block until every unit submitted to this batch so far has finished.
         * Returns immediately when nothing is pending.
         *
         * @return number of units that failed
         */
        public int awaitAll() {
            List<Future<?>> current;
            synchronized (lock) {
                current = pending;
                pending = new ArrayList<>();
            }

            int failures = 0;
            for (Future<?> future : current) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    failures++;
                    logger.warn("Unit of work failed: {}", e.getCause().toString(), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MosaicException("Interrupted while waiting for " + current.size() + " unit(s)", e);
                }
            }
            return failures;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "mosaic-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
