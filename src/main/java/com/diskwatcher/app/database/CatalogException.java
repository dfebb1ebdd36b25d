package com.diskwatcher.app.database;

/** Unchecked failure of a catalog store operation. */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
