package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.UserIdError;

/**
 * Value Object for User identity.
 * Wraps the numeric database key so user ids cannot be mixed up with tweet or media ids.
 */
public record UserId(long value) {

    public UserId {
        if (value <= 0) {
            throw new IllegalStateException("UserId must be positive, was " + value + " - use parse() for validation");
        }
    }

    /**
     * Parses a string (typically a path segment) into a UserId, returning a Result for expected validation failures.
     */
    public static Result<UserId, UserIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(UserIdError.Empty.INSTANCE);
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed <= 0) {
                return Result.failure(new UserIdError.InvalidFormat(value));
            }
            return Result.success(new UserId(parsed));
        } catch (NumberFormatException e) {
            return Result.failure(new UserIdError.InvalidFormat(value));
        }
    }

    /**
     * Creates a UserId from a trusted source (database rows, the authenticated request).
     */
    public static UserId of(long value) {
        return new UserId(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
