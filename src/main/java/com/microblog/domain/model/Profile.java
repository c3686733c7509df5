package com.microblog.domain.model;

import java.util.List;

/**
 * A user together with both directions of their follow graph.
 */
public record Profile(
    UserSummary user,
    List<UserSummary> followers,
    List<UserSummary> following
) {
}
