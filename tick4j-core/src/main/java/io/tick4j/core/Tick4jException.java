package io.tick4j.core;

/**
 * Base class of all scheduler exceptions.
 */
public class Tick4jException extends RuntimeException {

    public Tick4jException(String message) {
        super(message);
    }

    public Tick4jException(String message, Throwable cause) {
        super(message, cause);
    }
}
