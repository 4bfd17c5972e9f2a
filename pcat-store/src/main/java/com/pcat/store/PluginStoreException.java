package com.pcat.store;

/**
 * Thrown when a catalog store operation fails (connection, SQL error, constraint violation).
 */
public class PluginStoreException extends RuntimeException {

    public PluginStoreException(String message) {
        super(message);
    }

    public PluginStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
