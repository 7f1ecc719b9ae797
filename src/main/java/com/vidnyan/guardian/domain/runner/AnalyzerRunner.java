package com.vidnyan.guardian.domain.runner;

import com.vidnyan.guardian.domain.analyzer.Invocation;
import com.vidnyan.guardian.domain.analyzer.InvocationResult;
import com.vidnyan.guardian.domain.analyzer.RawOutput;
import com.vidnyan.guardian.domain.error.ToolUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes invocations on a bounded worker pool.
 *
 * <p>Each invocation has its own timeout; the whole batch is bounded by a run deadline
 * after which running workers are interrupted and their processes destroyed. Results
 * already recorded are kept. Invocations are attempted once.
 */
@Slf4j
public class AnalyzerRunner {

    private static final Duration CANCEL_GRACE = Duration.ofSeconds(5);

    private final CommandExecutor executor;
    private final int maxConcurrency;
    private final Duration runDeadline;

    public AnalyzerRunner(CommandExecutor executor, int maxConcurrency, Duration runDeadline) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        this.executor = executor;
        this.maxConcurrency = maxConcurrency;
        this.runDeadline = runDeadline;
    }

    /**
     * Run all invocations. Results come back in invocation order, one per invocation.
     */
    public List<InvocationResult> run(List<Invocation> invocations) {
        return run(invocations, maxConcurrency);
    }

    /**
     * Run with a caller-supplied concurrency bound.
     */
    public List<InvocationResult> run(List<Invocation> invocations, int concurrency) {
        InvocationCollector collector = new InvocationCollector();
        if (invocations.isEmpty()) {
            return List.of();
        }

        int workers = Math.max(1, Math.min(concurrency, invocations.size()));
        log.info("Running {} invocations with {} workers (deadline {}s)",
                invocations.size(), workers, runDeadline.toSeconds());

        ExecutorService pool = Executors.newFixedThreadPool(workers, new RunnerThreadFactory());
        for (Invocation invocation : invocations) {
            pool.execute(() -> collector.record(execute(invocation)));
        }
        pool.shutdown();

        awaitDeadline(pool);

        for (Invocation invocation : invocations) {
            if (!collector.contains(invocation.id())) {
                log.warn("{} did not finish before the run deadline", invocation.id());
                collector.record(InvocationResult.timedOut(invocation, runDeadline, "run deadline exceeded"));
            }
        }
        return invocations.stream().map(i -> collector.get(i.id())).toList();
    }

    private void awaitDeadline(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(runDeadline.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run deadline of {}s reached; cancelling running analyzers", runDeadline.toSeconds());
                pool.shutdownNow();
                if (!pool.awaitTermination(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.error("Some analyzer workers did not stop within {}s", CANCEL_GRACE.toSeconds());
                }
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    InvocationResult execute(Invocation invocation) {
        Instant start = Instant.now();
        log.info("  Starting {}: {}", invocation.id(), String.join(" ", invocation.commandLine()));
        try {
            CommandExecutor.CommandResult result = executor.execute(invocation, invocation.timeout());
            if (result.timedOut()) {
                log.warn("  {} timed out after {}s", invocation.id(), invocation.timeout().toSeconds());
                return InvocationResult.timedOut(invocation, result.elapsed(),
                        "timed out after " + invocation.timeout().toSeconds() + "s");
            }
            if (result.cancelled()) {
                return InvocationResult.timedOut(invocation, result.elapsed(), "cancelled at run deadline");
            }
            log.info("  {} exited with {} in {}ms", invocation.id(), result.exitCode(), result.elapsed().toMillis());
            if (result.truncated()) {
                log.warn("  {} output exceeded the capture limit and was truncated", invocation.id());
            }
            return InvocationResult.completed(invocation,
                    new RawOutput(result.exitCode(), result.stdout(), result.stderr(), result.truncated()),
                    result.elapsed());
        } catch (ToolUnavailableException e) {
            log.warn("  {} could not be started: {}", invocation.id(), e.getMessage());
            return InvocationResult.unavailable(invocation, e.getMessage());
        } catch (RuntimeException e) {
            log.error("  {} failed unexpectedly: {}", invocation.id(), e.getMessage(), e);
            return InvocationResult.error(invocation, Duration.between(start, Instant.now()), e.getMessage());
        }
    }

    private static class RunnerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "guardian-runner-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
