package com.microblog.application.service;

import com.microblog.application.port.in.ResolveIdentityUseCase;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.IdentityError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves api keys to users. Keys are opaque bearer tokens compared by exact match:
 * no signature, no expiry.
 */
@Service
public class IdentityService implements ResolveIdentityUseCase {

    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);

    private final UserRepository userRepository;

    public IdentityService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Result<User, IdentityError> resolve(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Result.failure(IdentityError.MissingApiKey.INSTANCE);
        }

        return userRepository.findByApiKey(apiKey)
            .<Result<User, IdentityError>>map(Result::success)
            .orElseGet(() -> {
                log.debug("No user for presented api key");
                return Result.failure(IdentityError.UnknownApiKey.INSTANCE);
            });
    }
}
