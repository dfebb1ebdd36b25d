package com.diskwatcher.app.identity;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external tool and returns its stdout. Empty when the tool is missing, exits non-zero
 * or exceeds the timeout.
 */
@FunctionalInterface
public interface CommandRunner {

    Optional<String> run(List<String> command, Duration timeout);

    static CommandRunner process() {
        return ProcessCommandRunner.INSTANCE;
    }

    final class ProcessCommandRunner implements CommandRunner {
        private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);
        static final ProcessCommandRunner INSTANCE = new ProcessCommandRunner();

        private ProcessCommandRunner() {}

        @Override
        public Optional<String> run(List<String> command, Duration timeout) {
            Process process;
            try {
                process = new ProcessBuilder(command)
                        .redirectError(ProcessBuilder.Redirect.DISCARD)
                        .start();
            } catch (IOException e) {
                logger.debug("command unavailable cmd={} error={}", command.get(0), e.toString());
                return Optional.empty();
            }

            // findmnt/lsblk output for a single target stays well under the pipe buffer
            try (InputStream out = process.getInputStream()) {
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    logger.debug("command timed out cmd={}", command);
                    return Optional.empty();
                }
                byte[] data = out.readAllBytes();
                if (process.exitValue() != 0) {
                    logger.debug("command failed cmd={} exit={}", command, process.exitValue());
                    return Optional.empty();
                }
                return Optional.of(new String(data, StandardCharsets.UTF_8));
            } catch (IOException e) {
                process.destroyForcibly();
                logger.debug("command output unreadable cmd={} error={}", command, e.toString());
                return Optional.empty();
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }
}
