package com.microblog.domain.error;

import com.microblog.domain.model.UserId;

/**
 * Sealed type representing expected business errors for like operations.
 */
public sealed interface LikeError extends DomainError {

    record TweetNotFound(long tweetId) implements LikeError {
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

    record AlreadyLiked(long tweetId, UserId userId) implements LikeError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFLICT;
        }

        @Override
        public String message() {
            return "User " + userId + " already liked tweet " + tweetId;
        }

        @Override
        public String code() {
            return "LikeError";
        }
    }

    record LikeNotFound(long tweetId, UserId userId) implements LikeError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }

        @Override
        public String message() {
            return "User " + userId + " has not liked tweet " + tweetId;
        }

        @Override
        public String code() {
            return "NotFound";
        }
    }
}
