package com.microblog.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError extends DomainError {

    @Override
    default ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }

    // UserId validation errors
    sealed interface UserIdError extends ValidationError {

        record Empty() implements UserIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "User ID cannot be empty";
            }

            @Override
            public String code() {
                return "ValidationError";
            }
        }

        record InvalidFormat(String value) implements UserIdError {
            @Override
            public String message() {
                return "User ID must be a positive integer: " + value;
            }

            @Override
            public String code() {
                return "ValidationError";
            }
        }
    }

    // Tweet validation errors
    sealed interface TweetError extends ValidationError {

        record EmptyContent() implements TweetError {
            public static final EmptyContent INSTANCE = new EmptyContent();
            @Override
            public String message() {
                return "Tweet content cannot be empty";
            }

            @Override
            public String code() {
                return "ValidationError";
            }
        }

        record ContentTooLong(int length, int maxLength) implements TweetError {
            @Override
            public String message() {
                return "Tweet content exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "ValidationError";
            }
        }
    }

    // Follow validation errors
    sealed interface FollowValidationError extends ValidationError {

        record SelfFollow() implements FollowValidationError {
            public static final SelfFollow INSTANCE = new SelfFollow();
            @Override
            public String message() {
                return "You cannot follow yourself";
            }

            @Override
            public String code() {
                return "FollowError";
            }
        }

        record SelfUnfollow() implements FollowValidationError {
            public static final SelfUnfollow INSTANCE = new SelfUnfollow();
            @Override
            public String message() {
                return "You cannot unfollow yourself";
            }

            @Override
            public String code() {
                return "FollowError";
            }
        }
    }
}
