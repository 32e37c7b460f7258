package dev.backprop.net.math;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Utilities for splitting work across an executor.
 *
 * <p>Work is cut into contiguous ranges, one task per range. Callers write results into
 * per-index slots and combine them afterwards in index order, so the outcome does not
 * depend on scheduling.
 */
public final class Parallelization {

    private static volatile int DEFAULT_THREAD_COUNT = Runtime.getRuntime().availableProcessors();

    /**
     * Check if the given work size should be split across threads.
     *
     * @param workSize number of independent work items
     * @param executor the executor service (null means no parallelization possible)
     * @return true if work should be split across multiple threads
     */
    public static boolean shouldParallelize(int workSize, ExecutorService executor) {
        return executor != null && workSize >= 2 && DEFAULT_THREAD_COUNT > 1;
    }

    /**
     * Number of tasks to split {@code workSize} items into (1 = don't parallelize).
     */
    public static int calculateOptimalThreads(int workSize, ExecutorService executor) {
        if (!shouldParallelize(workSize, executor))
            return 1;
        return Math.min(workSize, DEFAULT_THREAD_COUNT);
    }

    /**
     * Split work evenly across threads.
     *
     * @param totalWork total work size
     * @param numThreads number of threads to split across
     * @return array of WorkRange objects defining start/end for each thread
     */
    public static WorkRange[] splitWork(int totalWork, int numThreads) {
        if (numThreads <= 1)
            return new WorkRange[]{new WorkRange(0, totalWork)};

        WorkRange[] ranges = new WorkRange[numThreads];
        int workPerThread = totalWork / numThreads;
        int remainder = totalWork % numThreads;

        int start = 0;
        for (int i = 0; i < numThreads; i++) {
            int size = workPerThread + (i < remainder ? 1 : 0);
            ranges[i] = new WorkRange(start, start + size);
            start += size;
        }

        return ranges;
    }

    /**
     * Run the tasks on the executor and wait for all of them.
     *
     * <p>A runtime exception thrown by a task is rethrown on the calling thread.
     *
     * @param executor the executor service
     * @param tasks the tasks to execute in parallel
     */
    public static void executeParallel(ExecutorService executor, Runnable... tasks) {
        if (tasks.length <= 1) {
            // Just run directly if only one task
            for (Runnable task : tasks)
                task.run();
            return;
        }

        List<Future<?>> futures = new ArrayList<>(tasks.length);
        for (Runnable task : tasks)
            futures.add(executor.submit(task));

        try {
            for (Future<?> future : futures)
                future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Parallel execution interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw new RuntimeException("Parallel task failed", cause);
        }
    }

    public static int getThreads() {
        return DEFAULT_THREAD_COUNT;
    }

    /**
     * Set the thread count used when splitting parallel work.
     *
     * @param threads new thread count (must be positive)
     */
    public static void setThreads(int threads) {
        if (threads <= 0)
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        DEFAULT_THREAD_COUNT = threads;
    }

    /**
     * Represents a range of work for a single thread.
     */
    public static class WorkRange {
        public final int start;
        public final int end;
        public final int size;

        public WorkRange(int start, int end) {
            this.start = start;
            this.end = end;
            this.size = end - start;
        }

        @Override
        public String toString() {
            return String.format("WorkRange[%d-%d, size=%d]", start, end, size);
        }
    }

    private Parallelization() {} // Prevent instantiation
}
