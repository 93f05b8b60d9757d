package com.e2eq.access.exceptions;

/**
 * Base checked exception for failures of the access-control core's collaborators.
 */
public class AccessControlException extends Exception {
    public AccessControlException() {
        super();
    }

    public AccessControlException(String message) {
        super(message);
    }

    public AccessControlException(String message, Throwable cause) {
        super(message, cause);
    }

    public AccessControlException(Throwable cause) {
        super(cause);
    }
}
