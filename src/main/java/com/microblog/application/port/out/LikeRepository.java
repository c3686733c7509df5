package com.microblog.application.port.out;

import com.microblog.domain.model.Like;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserSummary;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface LikeRepository {

    /**
     * Inserts the like. The (tweet, user) primary key is the only duplicate check: a second like
     * fails with {@link org.springframework.dao.DuplicateKeyException}, and the insert is rolled back
     * to a savepoint so the caller's transaction stays usable.
     */
    void save(Like like);

    /**
     * @return true if a like was removed
     */
    boolean delete(long tweetId, UserId userId);

    int deleteByTweetId(long tweetId);

    /**
     * Likers per tweet id. Tweets without likes are absent from the map.
     */
    Map<Long, List<UserSummary>> findLikersByTweetIds(Collection<Long> tweetIds);

    long count();
}
