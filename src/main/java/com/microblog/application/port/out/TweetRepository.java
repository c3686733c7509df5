package com.microblog.application.port.out;

import com.microblog.domain.model.Tweet;
import com.microblog.domain.model.UserSummary;

import java.util.List;
import java.util.Optional;

public interface TweetRepository {
    void save(Tweet tweet);
    Optional<Tweet> findById(long id);
    boolean exists(long id);

    /**
     * All tweets with their authors, in ascending id order. This order is the feed's tie-break.
     */
    List<AuthoredTweet> findAllWithAuthors();

    /**
     * @return true if a row was deleted
     */
    boolean delete(long id);

    long count();

    record AuthoredTweet(Tweet tweet, UserSummary author) {}
}
