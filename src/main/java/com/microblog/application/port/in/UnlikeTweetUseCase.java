package com.microblog.application.port.in;

import com.microblog.domain.error.LikeError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;

public interface UnlikeTweetUseCase {
    Result<Void, LikeError> unlikeTweet(User user, long tweetId);
}
