package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.FollowValidationError;

public record Follow(
    UserId followerId,
    UserId followedId
) {
    /**
     * Creates a Follow relationship, returning a Result for expected validation failures.
     */
    public static Result<Follow, FollowValidationError> create(UserId followerId, UserId followedId) {
        if (followerId.equals(followedId)) {
            return Result.failure(FollowValidationError.SelfFollow.INSTANCE);
        }
        return Result.success(new Follow(followerId, followedId));
    }

    /**
     * Identifies an existing relationship to remove. A user can never be following themselves,
     * so asking to unfollow yourself is rejected before touching the store.
     */
    public static Result<Follow, FollowValidationError> forRemoval(UserId followerId, UserId followedId) {
        if (followerId.equals(followedId)) {
            return Result.failure(FollowValidationError.SelfUnfollow.INSTANCE);
        }
        return Result.success(new Follow(followerId, followedId));
    }
}
