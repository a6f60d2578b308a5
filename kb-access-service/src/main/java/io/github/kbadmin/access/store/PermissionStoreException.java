package io.github.kbadmin.access.store;

/**
 * Thrown when a grant read or write fails in the underlying database. The failed statement is
 * rolled back, so no partial grant state is visible.
 */
public class PermissionStoreException extends RuntimeException {

    public PermissionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
