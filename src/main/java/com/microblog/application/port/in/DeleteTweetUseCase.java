package com.microblog.application.port.in;

import com.microblog.domain.error.TweetError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;

public interface DeleteTweetUseCase {
    Result<Void, TweetError> deleteTweet(User caller, long tweetId);
}
