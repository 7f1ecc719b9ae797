package com.vidnyan.guardian.domain.runner;

import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.ExecutionStatus;
import com.vidnyan.guardian.domain.analyzer.Invocation;
import com.vidnyan.guardian.domain.analyzer.InvocationResult;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.error.ToolUnavailableException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.vidnyan.guardian.TestSpecs.spec;
import static org.junit.jupiter.api.Assertions.*;

class AnalyzerRunnerTest {

    private static final Path ROOT = Path.of(".");

    private static List<Invocation> invocations(int count) {
        List<Invocation> invocations = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            AnalyzerSpec spec = spec("tool" + i, "python", OutputFormat.LINE, "tool" + i);
            invocations.add(new Invocation(spec.id() + "#" + (i + 1), spec, ROOT, List.of(), spec.command()));
        }
        return invocations;
    }

    @Test
    void run_ShouldNeverExceedConcurrencyBound() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CommandExecutor executor = (invocation, timeout) -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                running.decrementAndGet();
            }
            return CommandExecutor.CommandResult.finished(0, "", "", false, Duration.ofMillis(50));
        };
        AnalyzerRunner runner = new AnalyzerRunner(executor, 4, Duration.ofSeconds(30));

        List<InvocationResult> results = runner.run(invocations(8), 2);

        assertEquals(8, results.size());
        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
        assertTrue(results.stream().allMatch(r -> r.status() == ExecutionStatus.SUCCESS));
    }

    @Test
    void run_ShouldReturnOneResultPerInvocationInOrder() {
        CommandExecutor executor = (invocation, timeout) ->
                CommandExecutor.CommandResult.finished(1, invocation.id(), "", false, Duration.ZERO);
        List<Invocation> invocations = invocations(5);

        List<InvocationResult> results = new AnalyzerRunner(executor, 3, Duration.ofSeconds(30)).run(invocations);

        assertEquals(invocations, results.stream().map(InvocationResult::invocation).toList());
        assertEquals("tool3#4", results.get(3).output().stdout());
    }

    @Test
    void run_ShouldRecordTimeoutsUnavailableToolsAndCrashes() {
        CommandExecutor executor = (invocation, timeout) -> switch (invocation.toolId()) {
            case "tool0" -> CommandExecutor.CommandResult.timedOut(timeout);
            case "tool1" -> throw new ToolUnavailableException("tool1", new IOException("No such file"));
            default -> throw new IllegalStateException("boom");
        };

        List<InvocationResult> results = new AnalyzerRunner(executor, 2, Duration.ofSeconds(30)).run(invocations(3));

        assertEquals(ExecutionStatus.TIMEOUT, results.get(0).status());
        assertFalse(results.get(0).hasOutput());
        assertEquals(ExecutionStatus.SKIPPED, results.get(1).status());
        assertEquals(ExecutionStatus.ERROR, results.get(2).status());
        assertEquals("boom", results.get(2).detail());
    }

    @Test
    void run_ShouldCancelInvocationsStillRunningAtTheDeadline() {
        CommandExecutor executor = (invocation, timeout) -> {
            if (invocation.toolId().equals("tool0")) {
                return CommandExecutor.CommandResult.finished(0, "", "", false, Duration.ZERO);
            }
            try {
                Thread.sleep(10_000);
                return CommandExecutor.CommandResult.finished(0, "", "", false, Duration.ofSeconds(10));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CommandExecutor.CommandResult.cancelled(Duration.ofMillis(200));
            }
        };
        AnalyzerRunner runner = new AnalyzerRunner(executor, 2, Duration.ofMillis(300));

        long start = System.nanoTime();
        List<InvocationResult> results = runner.run(invocations(2));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertEquals(ExecutionStatus.SUCCESS, results.get(0).status());
        assertEquals(ExecutionStatus.TIMEOUT, results.get(1).status());
        assertTrue(elapsedMillis < 5_000, "runner took " + elapsedMillis + "ms");
    }

    @Test
    void run_ShouldReturnNothingForNoInvocations() {
        CommandExecutor executor = (invocation, timeout) -> fail("nothing to run");

        assertTrue(new AnalyzerRunner(executor, 4, Duration.ofSeconds(1)).run(List.of()).isEmpty());
    }

    @Test
    void collector_ShouldKeepFirstResultPerInvocation() {
        Invocation invocation = invocations(1).get(0);
        InvocationCollector collector = new InvocationCollector();

        assertTrue(collector.record(InvocationResult.error(invocation, Duration.ZERO, "first")));
        assertFalse(collector.record(InvocationResult.error(invocation, Duration.ZERO, "second")));

        assertTrue(collector.contains(invocation.id()));
        assertEquals("first", collector.get(invocation.id()).detail());
    }
}
