package com.microblog.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.microblog.domain.model.UserSummary;

public record UserSummaryResponse(
    @JsonProperty("id") long id,
    @JsonProperty("name") String name
) {
    public static UserSummaryResponse from(UserSummary user) {
        return new UserSummaryResponse(user.id().value(), user.name());
    }
}
