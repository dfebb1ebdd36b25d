package com.diskwatcher.app.database;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded exponential backoff around a store call. Only SQLite BUSY/LOCKED is retried;
 * anything else surfaces immediately.
 */
public final class BusyRetry {

    private static final Logger logger = LoggerFactory.getLogger(BusyRetry.class);

    public static final int DEFAULT_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(50);

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final int maxAttempts;
    private final long baseDelayMillis;

    public BusyRetry() {
        this(DEFAULT_ATTEMPTS, DEFAULT_BASE_DELAY);
    }

    public BusyRetry(int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = Math.max(0, baseDelay.toMillis());
    }

    public <T> T call(String operation, Supplier<T> work) {
        long delay = baseDelayMillis;
        for (int attempt = 1; ; attempt++) {
            try {
                return work.get();
            } catch (RuntimeException e) {
                if (!isBusy(e)) {
                    throw wrap(operation, e);
                }
                if (attempt >= maxAttempts) {
                    throw new CatalogBusyException(operation, attempt, e);
                }
                logger.debug("catalog busy op={} attempt={} retryInMs={}", operation, attempt, delay);
                sleep(delay, operation, attempt, e);
                delay *= 2;
            }
        }
    }

    public void run(String operation, Runnable work) {
        call(operation, () -> {
            work.run();
            return null;
        });
    }

    static boolean isBusy(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql) {
                int code = sql.getErrorCode();
                if (code == SQLITE_BUSY || code == SQLITE_LOCKED) return true;
            }
            String msg = t.getMessage();
            if (msg != null) {
                String low = msg.toLowerCase(Locale.ROOT);
                if (low.contains("database is locked") || low.contains("sqlite_busy") || low.contains("sqlite_locked")) {
                    return true;
                }
            }
            if (t.getCause() == t) break;
        }
        return false;
    }

    private static RuntimeException wrap(String operation, RuntimeException e) {
        if (e instanceof CatalogException) return e;
        if (e instanceof JdbiException) return new CatalogException("catalog operation failed: " + operation, e);
        return e;
    }

    private static void sleep(long millis, String operation, int attempt, RuntimeException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CatalogBusyException(operation, attempt, cause);
        }
    }
}
