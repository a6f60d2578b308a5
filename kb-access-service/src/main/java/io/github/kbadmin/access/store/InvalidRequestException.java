package io.github.kbadmin.access.store;

/** Malformed entity type, level, or a missing required field. */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
