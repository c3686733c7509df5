package com.microblog.domain.error;

/**
 * Reasons an api key could not be resolved to a user. Both surface as unauthorized access.
 */
public sealed interface IdentityError extends DomainError {

    @Override
    default ErrorKind kind() {
        return ErrorKind.UNAUTHORIZED;
    }

    @Override
    default String code() {
        return "Unauthorized";
    }

    record MissingApiKey() implements IdentityError {
        public static final MissingApiKey INSTANCE = new MissingApiKey();

        @Override
        public String message() {
            return "Missing api-key header";
        }
    }

    record UnknownApiKey() implements IdentityError {
        public static final UnknownApiKey INSTANCE = new UnknownApiKey();

        @Override
        public String message() {
            return "User not found";
        }
    }
}
