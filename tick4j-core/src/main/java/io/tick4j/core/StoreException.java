package io.tick4j.core;

/**
 * A {@link JobStore} operation failed.
 */
public class StoreException extends Tick4jException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
