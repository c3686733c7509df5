package com.microblog.domain.error;

import com.microblog.domain.model.UserId;

/**
 * Sealed type representing expected business errors for follow operations at the application layer.
 * These errors are determined by querying state (repository), not by domain validation.
 *
 * For domain validation errors (like self-follow), see ValidationError.FollowValidationError.
 */
public sealed interface FollowError extends DomainError {

    record TargetNotFound(UserId targetId) implements FollowError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }

        @Override
        public String message() {
            return "User to follow not found: " + targetId;
        }

        @Override
        public String code() {
            return "NotFound";
        }
    }

    record AlreadyFollowing(UserId followerId, UserId followedId) implements FollowError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }

        @Override
        public String message() {
            return "User " + followerId + " is already following " + followedId;
        }

        @Override
        public String code() {
            return "FollowError";
        }
    }

    record NotFollowing(UserId followerId, UserId followedId) implements FollowError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }

        @Override
        public String message() {
            return "User " + followerId + " is not following " + followedId;
        }

        @Override
        public String code() {
            return "NotFound";
        }
    }

    /**
     * Wraps a domain validation error (self-follow, self-unfollow).
     */
    record ValidationFailed(ValidationError error) implements FollowError {
        @Override
        public ErrorKind kind() {
            return error.kind();
        }

        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }
}
