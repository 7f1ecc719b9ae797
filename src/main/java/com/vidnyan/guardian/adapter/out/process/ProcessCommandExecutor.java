package com.vidnyan.guardian.adapter.out.process;

import com.vidnyan.guardian.config.GuardianProperties;
import com.vidnyan.guardian.domain.analyzer.Invocation;
import com.vidnyan.guardian.domain.error.ToolUnavailableException;
import com.vidnyan.guardian.domain.runner.CommandExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs analyzers as local processes.
 *
 * <p>Each process gets the repository root as working directory and a private scratch
 * directory exposed as {@code TMPDIR} and {@code XDG_CACHE_HOME}, removed afterwards.
 * Both streams are drained on their own threads and capped at {@code maxOutputBytes}.
 * A timed-out or interrupted process is destroyed forcibly.
 */
@Slf4j
@Component
public class ProcessCommandExecutor implements CommandExecutor {

    private static final long READER_JOIN_MILLIS = TimeUnit.SECONDS.toMillis(2);

    private final int maxOutputBytes;
    private final Path scratchRoot;

    @Autowired
    public ProcessCommandExecutor(GuardianProperties properties) {
        this(properties.getRunner().getMaxOutputBytes(),
                properties.getRunner().getScratchRoot().isBlank() ? null : Path.of(properties.getRunner().getScratchRoot()));
    }

    public ProcessCommandExecutor(int maxOutputBytes, Path scratchRoot) {
        this.maxOutputBytes = maxOutputBytes;
        this.scratchRoot = scratchRoot;
    }

    @Override
    public CommandResult execute(Invocation invocation, Duration timeout) {
        Path scratch = createScratch(invocation);
        try {
            return run(invocation, timeout, scratch);
        } finally {
            deleteScratch(scratch);
        }
    }

    private CommandResult run(Invocation invocation, Duration timeout, Path scratch) {
        ProcessBuilder builder = new ProcessBuilder(invocation.commandLine());
        builder.directory(invocation.workingDirectory().toFile());
        builder.redirectErrorStream(false);
        Map<String, String> environment = builder.environment();
        environment.put("TMPDIR", scratch.toString());
        environment.put("XDG_CACHE_HOME", scratch.toString());

        Instant start = Instant.now();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ToolUnavailableException(invocation.spec().executable(), e);
        }
        closeInput(process);

        OutputCollector stdout = new OutputCollector(maxOutputBytes);
        OutputCollector stderr = new OutputCollector(maxOutputBytes);
        Thread stdoutReader = startReader(process.getInputStream(), stdout, invocation.id() + "-stdout");
        Thread stderrReader = startReader(process.getErrorStream(), stderr, invocation.id() + "-stderr");

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroy(process);
                joinQuietly(stdoutReader, stderrReader);
                return CommandResult.timedOut(Duration.between(start, Instant.now()));
            }
            stdoutReader.join(READER_JOIN_MILLIS);
            stderrReader.join(READER_JOIN_MILLIS);
            return CommandResult.finished(process.exitValue(), stdout.text(), stderr.text(),
                    stdout.truncated() || stderr.truncated(), Duration.between(start, Instant.now()));
        } catch (InterruptedException e) {
            destroy(process);
            Thread.currentThread().interrupt();
            log.warn("{} interrupted; process destroyed", invocation.id());
            return CommandResult.cancelled(Duration.between(start, Instant.now()));
        }
    }

    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void closeInput(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close process stdin: {}", e.getMessage());
        }
    }

    private static void joinQuietly(Thread... readers) {
        for (Thread reader : readers) {
            try {
                reader.join(READER_JOIN_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static Thread startReader(InputStream stream, OutputCollector collector, String name) {
        Thread reader = new Thread(() -> collector.consume(stream), name);
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private Path createScratch(Invocation invocation) {
        String prefix = "guardian-" + invocation.toolId() + "-";
        try {
            return scratchRoot != null
                    ? Files.createTempDirectory(Files.createDirectories(scratchRoot), prefix)
                    : Files.createTempDirectory(prefix);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create scratch directory for " + invocation.id(), e);
        }
    }

    private static void deleteScratch(Path scratch) {
        try (Stream<Path> paths = Files.walk(scratch)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not delete scratch entry {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean scratch directory {}: {}", scratch, e.getMessage());
        }
    }

    /**
     * Byte-capped sink for one process stream. Bytes past the cap are read and dropped
     * so the process never blocks on a full pipe.
     */
    static final class OutputCollector {

        private final int limit;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private volatile boolean truncated;

        OutputCollector(int limit) {
            this.limit = limit;
        }

        void consume(InputStream stream) {
            byte[] chunk = new byte[8192];
            try (stream) {
                int read;
                while ((read = stream.read(chunk)) != -1) {
                    append(chunk, read);
                }
            } catch (IOException e) {
                log.debug("Failed to read process stream: {}", e.getMessage());
            }
        }

        synchronized void append(byte[] chunk, int length) {
            int room = limit - buffer.size();
            if (room <= 0) {
                truncated = true;
                return;
            }
            int accepted = Math.min(room, length);
            buffer.write(chunk, 0, accepted);
            if (accepted < length) {
                truncated = true;
            }
        }

        synchronized String text() {
            return buffer.toString(StandardCharsets.UTF_8);
        }

        boolean truncated() {
            return truncated;
        }
    }
}
