package com.microblog.domain.error;

/**
 * Transport-neutral error categories. Adapters translate a kind to their own status codes
 * in exactly one place.
 */
public enum ErrorKind {
    UNAUTHORIZED,
    NOT_FOUND,
    FORBIDDEN,
    CONFLICT,
    VALIDATION,
    INTERNAL
}
