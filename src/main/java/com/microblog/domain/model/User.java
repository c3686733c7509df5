package com.microblog.domain.model;

/**
 * A provisioned account. The api key is an opaque bearer credential: it is matched exactly,
 * never parsed, and never leaves the service.
 */
public record User(
    UserId id,
    String name,
    String apiKey
) {
    public UserSummary summary() {
        return new UserSummary(id, name);
    }

    @Override
    public String toString() {
        return "User[id=" + id + ", name=" + name + "]";
    }
}
