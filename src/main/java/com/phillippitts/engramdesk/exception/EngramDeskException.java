package com.phillippitts.engramdesk.exception;

/**
 * Base exception for all Engram Desk application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class EngramDeskException extends RuntimeException {

    public EngramDeskException(String message) {
        super(message);
    }

    public EngramDeskException(String message, Throwable cause) {
        super(message, cause);
    }

    public EngramDeskException(Throwable cause) {
        super(cause);
    }
}
