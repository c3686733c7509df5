package com.microblog.infrastructure.exception;

/**
 * Raised when an uploaded file cannot be written to the media root.
 * Not a business outcome: it reaches the global exception handler as a 500.
 */
public class MediaStorageException extends RuntimeException {

    public MediaStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
