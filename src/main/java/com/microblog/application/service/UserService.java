package com.microblog.application.service;

import com.microblog.application.port.in.GetProfileUseCase;
import com.microblog.application.port.out.FollowRepository;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.UserError;
import com.microblog.domain.model.Profile;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class UserService implements GetProfileUseCase {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final FollowRepository followRepository;

    public UserService(UserRepository userRepository, FollowRepository followRepository) {
        this.userRepository = userRepository;
        this.followRepository = followRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Result<Profile, UserError> getProfile(UserId userId) {
        Optional<User> user = userRepository.findById(userId);
        if (user.isEmpty()) {
            log.debug("Profile requested for unknown user={}", userId);
            return Result.failure(new UserError.UserNotFound(userId));
        }

        // Two directed queries, no back-references
        List<UserSummary> followers = followRepository.findFollowers(userId);
        List<UserSummary> following = followRepository.findFollowing(userId);
        log.debug("Profile loaded: user={}, followers={}, following={}", userId, followers.size(), following.size());

        return Result.success(new Profile(user.get().summary(), followers, following));
    }
}
