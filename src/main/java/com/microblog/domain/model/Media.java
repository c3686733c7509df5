package com.microblog.domain.model;

/**
 * An uploaded file, stored under its owner's directory before any tweet references it.
 */
public record Media(
    long id,
    UserId userId,
    String path
) {
}
