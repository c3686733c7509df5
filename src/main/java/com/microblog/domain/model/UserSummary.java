package com.microblog.domain.model;

/**
 * Public {id, name} projection of a user, as shown for authors, likers, followers and followees.
 */
public record UserSummary(UserId id, String name) {
}
