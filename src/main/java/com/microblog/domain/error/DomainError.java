package com.microblog.domain.error;

/**
 * Common shape of every expected business error.
 */
public interface DomainError {

    ErrorKind kind();

    /**
     * Short error type shown to clients, e.g. {@code NotFound} or {@code FollowError}.
     */
    String code();

    String message();
}
