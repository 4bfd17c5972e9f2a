package com.pcat.manifest;

/**
 * Thrown when manifest content is not valid YAML or does not bind to the declared plugin shape.
 * During a populate pass the entry is skipped; on the lookup path it means stored state is corrupt.
 */
public final class ManifestParseException extends RuntimeException {

    public ManifestParseException(String message) {
        super(message);
    }

    public ManifestParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
