package com.pcat.sync;

/**
 * Fatal failure of a populate pass (archive fetch, archive open, catalog listing). The message names the step;
 * the cause carries the underlying error.
 */
public final class CatalogSyncException extends RuntimeException {

    public CatalogSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
