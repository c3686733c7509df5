package com.microblog.application.port.in;

import com.microblog.domain.model.FeedTweet;
import com.microblog.domain.model.User;

import java.util.List;

public interface GetFeedUseCase {
    List<FeedTweet> getFeed(User viewer);
}
