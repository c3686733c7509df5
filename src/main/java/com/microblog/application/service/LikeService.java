package com.microblog.application.service;

import com.microblog.application.port.in.LikeTweetUseCase;
import com.microblog.application.port.in.UnlikeTweetUseCase;
import com.microblog.application.port.out.LikeRepository;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.TweetRepository;
import com.microblog.domain.error.LikeError;
import com.microblog.domain.model.Like;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LikeService implements LikeTweetUseCase, UnlikeTweetUseCase {

    private static final Logger log = LoggerFactory.getLogger(LikeService.class);

    private final LikeRepository likeRepository;
    private final TweetRepository tweetRepository;
    private final MetricsPort metrics;

    public LikeService(LikeRepository likeRepository, TweetRepository tweetRepository, MetricsPort metrics) {
        this.likeRepository = likeRepository;
        this.tweetRepository = tweetRepository;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<Void, LikeError> likeTweet(User user, long tweetId) {
        log.debug("Processing like request: tweetId={}, user={}", tweetId, user.id());

        if (!tweetRepository.exists(tweetId)) {
            log.debug("Like target not found: tweetId={}", tweetId);
            return Result.failure(new LikeError.TweetNotFound(tweetId));
        }

        // No pre-check: the primary key decides, so two concurrent likes cannot both succeed
        try {
            likeRepository.save(new Like(tweetId, user.id()));
        } catch (DuplicateKeyException e) {
            log.debug("Already liked: tweetId={}, user={}", tweetId, user.id());
            return Result.failure(new LikeError.AlreadyLiked(tweetId, user.id()));
        }

        metrics.incrementLikes();
        log.info("Like completed: user={} -> tweet={}", user.id(), tweetId);

        return Result.ok();
    }

    @Override
    @Transactional
    public Result<Void, LikeError> unlikeTweet(User user, long tweetId) {
        log.debug("Processing unlike request: tweetId={}, user={}", tweetId, user.id());

        if (!likeRepository.delete(tweetId, user.id())) {
            log.debug("Like not found: tweetId={}, user={}", tweetId, user.id());
            return Result.failure(new LikeError.LikeNotFound(tweetId, user.id()));
        }

        metrics.incrementUnlikes();
        log.info("Unlike completed: user={} -> tweet={}", user.id(), tweetId);

        return Result.ok();
    }
}
