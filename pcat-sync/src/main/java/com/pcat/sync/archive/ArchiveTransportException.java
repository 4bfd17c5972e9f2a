package com.pcat.sync.archive;

import java.io.IOException;

/**
 * Thrown when a remote archive cannot be fetched: bad address, request failure, interruption, or a non-2xx status.
 */
public final class ArchiveTransportException extends IOException {

    private final int statusCode;

    public ArchiveTransportException(String message) {
        this(message, -1, null);
    }

    public ArchiveTransportException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ArchiveTransportException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed response; -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
