package com.microblog.domain.error;

import java.util.List;

/**
 * Sealed type representing expected business errors for tweet operations at the application layer.
 */
public sealed interface TweetError extends DomainError {

    /**
     * Wraps a domain validation error that occurred during tweet creation.
     */
    record ValidationFailed(ValidationError error) implements TweetError {
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

    record MediaNotFound(List<Long> missingMediaIds) implements TweetError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }

        @Override
        public String message() {
            return "File not found: media " + missingMediaIds;
        }

        @Override
        public String code() {
            return "NotFound";
        }
    }

    record TweetNotFound(long tweetId) implements TweetError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }

        @Override
        public String message() {
            return "Tweet not found: " + tweetId;
        }

        @Override
        public String code() {
            return "NotFound";
        }
    }

    record NotOwner(long tweetId) implements TweetError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.FORBIDDEN;
        }

        @Override
        public String message() {
            return "Not enough permissions to delete tweet " + tweetId;
        }

        @Override
        public String code() {
            return "Forbidden";
        }
    }
}
