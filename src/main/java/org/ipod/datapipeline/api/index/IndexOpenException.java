package org.ipod.datapipeline.api.index;

/**
 * Thrown when a precovery index cannot be opened, does not exist or has an unsupported
 * format version.
 */
public class IndexOpenException extends RuntimeException {

    public IndexOpenException(String message) {
        super(message);
    }

    public IndexOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
