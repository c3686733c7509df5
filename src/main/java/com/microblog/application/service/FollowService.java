package com.microblog.application.service;

import com.microblog.application.port.in.FollowUserUseCase;
import com.microblog.application.port.in.UnfollowUserUseCase;
import com.microblog.application.port.out.FollowRepository;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.FollowError;
import com.microblog.domain.model.Follow;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class FollowService implements FollowUserUseCase, UnfollowUserUseCase {

    private static final Logger log = LoggerFactory.getLogger(FollowService.class);

    private final FollowRepository followRepository;
    private final UserRepository userRepository;
    private final MetricsPort metrics;

    public FollowService(
            FollowRepository followRepository,
            UserRepository userRepository,
            MetricsPort metrics) {
        this.followRepository = followRepository;
        this.userRepository = userRepository;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<Void, FollowError> followUser(User follower, UserId targetId) {
        log.debug("Processing follow request: follower={}, followed={}", follower.id(), targetId);

        // Domain validation via Follow.create()
        var followResult = Follow.create(follower.id(), targetId);
        if (followResult.isFailure()) {
            log.warn("Follow validation failed: {}", followResult.errorOrNull().message());
            return Result.failure(new FollowError.ValidationFailed(followResult.errorOrNull()));
        }

        if (!userRepository.exists(targetId)) {
            log.debug("Follow target not found: {}", targetId);
            return Result.failure(new FollowError.TargetNotFound(targetId));
        }

        // The primary key decides; a lost race is a conflict, not a system error
        try {
            followRepository.save(followResult.getOrThrow());
        } catch (DuplicateKeyException e) {
            log.debug("Already following: follower={}, followed={}", follower.id(), targetId);
            return Result.failure(new FollowError.AlreadyFollowing(follower.id(), targetId));
        }

        metrics.incrementFollows();
        log.info("Follow completed: {} -> {}", follower.id(), targetId);

        return Result.ok();
    }

    @Override
    @Transactional
    public Result<Void, FollowError> unfollow(User follower, UserId targetId) {
        log.debug("Processing unfollow request: follower={}, followed={}", follower.id(), targetId);

        var edgeResult = Follow.forRemoval(follower.id(), targetId);
        if (edgeResult.isFailure()) {
            log.warn("Unfollow validation failed: {}", edgeResult.errorOrNull().message());
            return Result.failure(new FollowError.ValidationFailed(edgeResult.errorOrNull()));
        }

        Follow edge = edgeResult.getOrThrow();
        if (!followRepository.delete(edge.followerId(), edge.followedId())) {
            log.debug("Not following: follower={}, followed={}", follower.id(), targetId);
            return Result.failure(new FollowError.NotFollowing(follower.id(), targetId));
        }

        metrics.incrementUnfollows();
        log.info("Unfollow completed: {} -> {}", follower.id(), targetId);

        return Result.ok();
    }
}
