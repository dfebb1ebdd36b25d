package com.diskwatcher.app.database;

/**
 * The store stayed busy/locked through every retry attempt. Callers log it and drop the write;
 * the job that issued it keeps going.
 */
public class CatalogBusyException extends CatalogException {

    private final int attempts;

    public CatalogBusyException(String operation, int attempts, Throwable cause) {
        super("catalog busy after " + attempts + " attempts: " + operation, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
