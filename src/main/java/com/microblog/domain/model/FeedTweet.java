package com.microblog.domain.model;

import java.util.Collection;
import java.util.List;

/**
 * A tweet as it appears in a feed: with its author and everyone who liked it.
 */
public record FeedTweet(
    Tweet tweet,
    UserSummary author,
    List<UserSummary> likes
) {
    public FeedTweet {
        likes = likes == null ? List.of() : List.copyOf(likes);
    }

    public int likeCount() {
        return likes.size();
    }

    public boolean isLikedByAnyOf(Collection<UserId> userIds) {
        return likes.stream().anyMatch(like -> userIds.contains(like.id()));
    }
}
