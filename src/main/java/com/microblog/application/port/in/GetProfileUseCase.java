package com.microblog.application.port.in;

import com.microblog.domain.error.UserError;
import com.microblog.domain.model.Profile;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;

public interface GetProfileUseCase {
    Result<Profile, UserError> getProfile(UserId userId);
}
