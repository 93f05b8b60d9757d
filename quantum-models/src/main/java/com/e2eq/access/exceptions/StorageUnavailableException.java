package com.e2eq.access.exceptions;

/**
 * Raised by policy, token and key stores when the backing storage cannot be reached
 * or did not complete an operation.
 */
public class StorageUnavailableException extends AccessControlException {
    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
