package in.ledgerguard.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * StrategyCoordinator - single writer per strategy.
 *
 * SINGLE-WRITER PER STRATEGY:
 * All ledger and slot mutations for a strategy are routed to the same executor
 * partition, so the controller, the assessment loop and the reconciliation engine
 * never interleave on one strategy. Unrelated strategies run in parallel.
 *
 * PARTITIONING STRATEGY:
 * - Partition count = clamp(availableProcessors(), 8, 32)
 * - Route by: hash(strategy) % partitions
 *
 * RE-ENTRANCY:
 * A task already running on a strategy's partition that submits more work for the
 * same partition runs it inline instead of queueing behind itself.
 */
public final class StrategyCoordinator {
    private static final Logger log = LoggerFactory.getLogger(StrategyCoordinator.class);

    private static final int MIN_PARTITIONS = 8;
    private static final int MAX_PARTITIONS = 32;
    private static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final ExecutorService[] partitions;
    private final int partitionCount;
    private final ThreadLocal<Integer> currentPartition = new ThreadLocal<>();

    public StrategyCoordinator() {
        this(calculateOptimalPartitions());
    }

    public StrategyCoordinator(int partitionCount) {
        if (partitionCount <= 0) {
            throw new IllegalArgumentException("Partition count must be positive");
        }
        this.partitionCount = partitionCount;
        this.partitions = new ExecutorService[partitionCount];

        for (int i = 0; i < partitionCount; i++) {
            final int partitionIndex = i;
            this.partitions[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread t = new Thread(() -> {
                    currentPartition.set(partitionIndex);
                    runnable.run();
                }, "strategy-coordinator-" + partitionIndex);
                t.setDaemon(true);
                return t;
            });
        }

        log.info("StrategyCoordinator initialized with {} partitions (CPUs: {})",
            partitionCount, Runtime.getRuntime().availableProcessors());
    }

    private static int calculateOptimalPartitions() {
        int processors = Runtime.getRuntime().availableProcessors();
        return Math.max(MIN_PARTITIONS, Math.min(MAX_PARTITIONS, processors));
    }

    /**
     * Execute a task on the strategy's partition.
     */
    public CompletableFuture<Void> execute(String strategy, Runnable task) {
        int partition = getPartition(strategy);
        if (isOnPartition(partition)) {
            try {
                task.run();
                return CompletableFuture.completedFuture(null);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return CompletableFuture.runAsync(task, partitions[partition]);
    }

    /**
     * Execute a task on the strategy's partition and return its result.
     */
    public <T> CompletableFuture<T> executeWithResult(String strategy, Callable<T> task) {
        int partition = getPartition(strategy);
        if (isOnPartition(partition)) {
            try {
                return CompletableFuture.completedFuture(task.call());
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, partitions[partition]);
    }

    /**
     * Run a task on the strategy's partition and wait for it.
     * Runtime exceptions thrown by the task are rethrown unchanged.
     */
    public <T> T call(String strategy, Callable<T> task) {
        try {
            return executeWithResult(strategy, task).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Strategy task failed: " + strategy, cause);
        }
    }

    private boolean isOnPartition(int partition) {
        Integer current = currentPartition.get();
        return current != null && current == partition;
    }

    private int getPartition(String strategy) {
        return Math.floorMod(strategy.hashCode(), partitionCount);
    }

    /**
     * Stop accepting tasks and wait for queued ones to finish.
     */
    public void shutdown() {
        shutdown(DEFAULT_DRAIN_TIMEOUT);
    }

    public void shutdown(Duration drainTimeout) {
        log.info("Shutting down StrategyCoordinator with {} partitions", partitionCount);

        for (ExecutorService partition : partitions) {
            partition.shutdown();
        }

        try {
            long deadline = System.nanoTime() + drainTimeout.toNanos();
            for (int i = 0; i < partitionCount; i++) {
                long remaining = Math.max(0, deadline - System.nanoTime());
                if (!partitions[i].awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Partition {} did not drain in time, forcing shutdown", i);
                    partitions[i].shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            log.error("Shutdown interrupted", e);
            for (ExecutorService partition : partitions) {
                partition.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }

        log.info("StrategyCoordinator shutdown complete");
    }

    public boolean isShutdown() {
        return partitions[0].isShutdown();
    }

    public int getPartitionCount() {
        return partitionCount;
    }
}
