package com.microblog.domain.model;

/**
 * A user's like on a tweet. The (tweetId, userId) pair is the identity; the store's
 * primary key on it is what rejects a second like.
 */
public record Like(
    long tweetId,
    UserId userId
) {
}
