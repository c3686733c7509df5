package com.microblog.application.port.out;

import com.microblog.domain.model.Follow;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserSummary;

import java.util.List;

public interface FollowRepository {

    /**
     * Inserts the follow edge. The (follower, followed) primary key is the only duplicate check:
     * a repeated follow fails with {@link org.springframework.dao.DuplicateKeyException}, rolled back
     * to a savepoint.
     */
    void save(Follow follow);

    /**
     * @return true if an edge was removed
     */
    boolean delete(UserId followerId, UserId followedId);

    /**
     * Users that follow {@code userId}, in ascending id order.
     */
    List<UserSummary> findFollowers(UserId userId);

    /**
     * Users that {@code userId} follows, in ascending id order.
     */
    List<UserSummary> findFollowing(UserId userId);

    List<UserId> findFollowedIds(UserId userId);

    long count();
}
