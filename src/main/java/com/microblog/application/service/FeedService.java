package com.microblog.application.service;

import com.microblog.application.port.in.GetFeedUseCase;
import com.microblog.application.port.out.FollowRepository;
import com.microblog.application.port.out.LikeRepository;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.TweetRepository;
import com.microblog.application.port.out.TweetRepository.AuthoredTweet;
import com.microblog.domain.model.FeedTweet;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserSummary;
import com.microblog.domain.ranking.FeedRanking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class FeedService implements GetFeedUseCase {

    private static final Logger log = LoggerFactory.getLogger(FeedService.class);

    private final TweetRepository tweetRepository;
    private final LikeRepository likeRepository;
    private final FollowRepository followRepository;
    private final MetricsPort metrics;

    public FeedService(
            TweetRepository tweetRepository,
            LikeRepository likeRepository,
            FollowRepository followRepository,
            MetricsPort metrics) {
        this.tweetRepository = tweetRepository;
        this.likeRepository = likeRepository;
        this.followRepository = followRepository;
        this.metrics = metrics;
    }

    @Override
    @Transactional(readOnly = true)
    public List<FeedTweet> getFeed(User viewer) {
        log.debug("Fetching feed for user={}", viewer.id());
        metrics.incrementFeedRequests();

        List<AuthoredTweet> tweets = tweetRepository.findAllWithAuthors();
        if (tweets.isEmpty()) {
            log.debug("Feed empty for user={}", viewer.id());
            return List.of();
        }

        List<Long> tweetIds = tweets.stream().map(t -> t.tweet().id()).toList();
        Map<Long, List<UserSummary>> likers = likeRepository.findLikersByTweetIds(tweetIds);

        List<FeedTweet> feed = tweets.stream()
            .map(t -> new FeedTweet(t.tweet(), t.author(), likers.getOrDefault(t.tweet().id(), List.of())))
            .toList();

        List<UserId> followed = followRepository.findFollowedIds(viewer.id());
        Set<UserId> relevant = FeedRanking.relevantUsers(viewer.id(), followed);

        List<FeedTweet> ranked = metrics.recordFeedRanking(() -> FeedRanking.rank(feed, relevant));

        log.info("Feed served: user={}, tweets={}, following={}", viewer.id(), ranked.size(), followed.size());
        return ranked;
    }
}
