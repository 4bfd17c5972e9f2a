package com.pcat.sync;

/**
 * Thrown by lookup for kinds or types the catalog does not serve. Only step plugins can be resolved.
 */
public final class UnsupportedLookupException extends RuntimeException {

    private final String kind;
    private final String type;

    public UnsupportedLookupException(String message, String kind, String type) {
        super(message);
        this.kind = kind;
        this.type = type;
    }

    public String getKind() {
        return kind;
    }

    public String getType() {
        return type;
    }
}
