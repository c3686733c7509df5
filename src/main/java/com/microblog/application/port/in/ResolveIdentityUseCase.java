package com.microblog.application.port.in;

import com.microblog.domain.error.IdentityError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;

public interface ResolveIdentityUseCase {
    Result<User, IdentityError> resolve(String apiKey);
}
