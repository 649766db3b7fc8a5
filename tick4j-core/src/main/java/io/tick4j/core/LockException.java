package io.tick4j.core;

public class LockException extends Tick4jException {

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
