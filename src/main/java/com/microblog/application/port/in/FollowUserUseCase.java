package com.microblog.application.port.in;

import com.microblog.domain.error.FollowError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

public interface FollowUserUseCase {
    Result<Void, FollowError> followUser(User follower, UserId targetId);
}
