package com.eyelevel.mediamigrator.common.processexec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Serial;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs external tools (ExifTool, the upload command) with a timeout and bounded output capture.
 */
@Component
@Slf4j
public class ProcessExecutor {

    /**
     * A safe limit for the amount of stdout/stderr to keep in memory. The most recent output is kept, since tools
     * print their result and their final error last.
     */
    private static final int MAX_CAPTURE_BYTES = 16 * 1024;

    /**
     * Executes a command-line process with a timeout and memory-safe stream handling.
     *
     * @param command        The command and its arguments to execute.
     * @param contextInfo    A string for logging context (e.g., the media item id).
     * @param timeoutMinutes The maximum time to wait for the process to complete.
     * @param processName    A descriptive name for the process (e.g., "exiftool").
     * @return A ProcessResult containing the exit code and the last part of stdout and stderr.
     * @throws IOException          if the process cannot be started, times out, or an I/O error occurs.
     * @throws InterruptedException if the waiting thread is interrupted; the process is killed first.
     */
    public ProcessResult execute(List<String> command, String contextInfo, long timeoutMinutes, String processName)
    throws IOException, InterruptedException {

        Process process = new ProcessBuilder(command).start();
        TailCapture stdoutCapture = new TailCapture(MAX_CAPTURE_BYTES);
        TailCapture stderrCapture = new TailCapture(MAX_CAPTURE_BYTES);

        ExecutorService streamReaders = Executors.newFixedThreadPool(2);
        try {
            streamReaders.submit(new StreamConsumer(process.getInputStream(), stdoutCapture, null));
            streamReaders.submit(new StreamConsumer(process.getErrorStream(), stderrCapture,
                                                    line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName,
                                                                     line)));

            boolean finished;
            try {
                finished = process.waitFor(timeoutMinutes, TimeUnit.MINUTES);
            } catch (InterruptedException e) {
                log.warn("[{}] Interrupted while waiting for {}; killing it.", contextInfo, processName);
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                throw new ProcessTimeoutException(
                        processName + " process timed out after " + timeoutMinutes + " minutes.");
            }
        } finally {
            streamReaders.shutdown();
            if (!streamReaders.awaitTermination(10, TimeUnit.SECONDS)) {
                streamReaders.shutdownNow();
            }
        }

        return new ProcessResult(process.exitValue(), stdoutCapture.toString().trim(), stderrCapture.toString().trim());
    }

    /**
     * Keeps the most recent lines of a stream, dropping the oldest once {@code maxBytes} is exceeded.
     */
    static final class TailCapture {
        private final int maxBytes;
        private final Deque<String> lines = new ArrayDeque<>();
        private int bytes;

        TailCapture(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        synchronized void append(String line) {
            String lineWithNewline = line + "\n";
            lines.addLast(lineWithNewline);
            bytes += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
            while (bytes > maxBytes && lines.size() > 1) {
                bytes -= lines.removeFirst().getBytes(StandardCharsets.UTF_8).length;
            }
        }

        @Override
        public synchronized String toString() {
            return String.join("", lines);
        }
    }

    /**
     * Consumes an InputStream into a {@link TailCapture}, and optionally logs each line.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final TailCapture capture;
        private final Consumer<String> lineLogger;

        StreamConsumer(InputStream inputStream, TailCapture capture, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.capture = capture;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    capture.append(line);
                }
            } catch (IOException e) {
                log.error("Error reading process stream.", e);
            }
        }
    }

    /**
     * Raised when an external process exceeds its time limit and is killed.
     */
    public static class ProcessTimeoutException extends IOException {
        @Serial
        private static final long serialVersionUID = -1187432090813226041L;

        public ProcessTimeoutException(String message) {
            super(message);
        }
    }

    /**
     * The result of an external process execution.
     *
     * @param exitCode The exit code of the process. 0 typically means success.
     * @param stdout   The captured standard output (its last part, up to a safe limit).
     * @param stderr   The captured standard error output (its last part, up to a safe limit).
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }
}
