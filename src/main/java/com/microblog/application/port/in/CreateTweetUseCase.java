package com.microblog.application.port.in;

import com.microblog.domain.error.TweetError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.Tweet;
import com.microblog.domain.model.User;

import java.util.List;

public interface CreateTweetUseCase {
    Result<Tweet, TweetError> createTweet(User author, String content, List<Long> mediaIds);
}
