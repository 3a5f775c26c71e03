package com.entity.semantic.pipeline;

import com.entity.semantic.metrics.MetricsService;
import com.entity.semantic.metrics.NoOpMetricsService;
import com.entity.semantic.tracing.NoOpTracingService;
import com.entity.semantic.tracing.TracingService;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Worker pool and observability plumbing shared by the pipelines.
 */
abstract class AbstractPipeline implements AutoCloseable {

    protected final PipelineOptions options;
    protected final MetricsService metrics;
    protected final TracingService tracing;
    private final ExecutorService workers;

    protected AbstractPipeline(String poolName, PipelineOptions options,
                               MetricsService metrics, TracingService tracing) {
        this.options = options != null ? options : PipelineOptions.defaults();
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.tracing = tracing != null ? tracing : new NoOpTracingService();
        this.workers = Executors.newFixedThreadPool(this.options.getWorkerThreads(), new WorkerThreadFactory(poolName));
    }

    /**
     * Runs the tasks on the worker pool and returns their results in task order.
     * A task that throws is mapped through {@code onFailure}; tasks are expected to
     * translate their own failures, so this only covers interruption and rejection.
     */
    protected <T> List<T> runAll(List<Callable<T>> tasks, Function<Throwable, T> onFailure) {
        if (tasks.size() == 1) {
            return Collections.singletonList(callInline(tasks.get(0), onFailure));
        }
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(workers.submit(task));
        }
        List<T> results = new ArrayList<>(tasks.size());
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(onFailure.apply(e));
            } catch (ExecutionException e) {
                results.add(onFailure.apply(e.getCause()));
            }
        }
        return results;
    }

    private static <T> T callInline(Callable<T> task, Function<Throwable, T> onFailure) {
        try {
            return task.call();
        } catch (Exception e) {
            return onFailure.apply(e);
        }
    }

    protected static long elapsedSince(long startNanos) {
        return System.nanoTime() - startNanos;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
