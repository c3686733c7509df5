package com.microblog.application.service;

import com.microblog.application.port.in.CreateTweetUseCase;
import com.microblog.application.port.in.DeleteTweetUseCase;
import com.microblog.application.port.out.IdGenerator;
import com.microblog.application.port.out.LikeRepository;
import com.microblog.application.port.out.MediaRepository;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.TweetRepository;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.TweetError;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.Tweet;
import com.microblog.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class TweetService implements CreateTweetUseCase, DeleteTweetUseCase {

    private static final Logger log = LoggerFactory.getLogger(TweetService.class);

    private final TweetRepository tweetRepository;
    private final MediaRepository mediaRepository;
    private final LikeRepository likeRepository;
    private final UserRepository userRepository;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;

    public TweetService(
            TweetRepository tweetRepository,
            MediaRepository mediaRepository,
            LikeRepository likeRepository,
            UserRepository userRepository,
            IdGenerator idGenerator,
            MetricsPort metrics) {
        this.tweetRepository = tweetRepository;
        this.mediaRepository = mediaRepository;
        this.likeRepository = likeRepository;
        this.userRepository = userRepository;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<Tweet, TweetError> createTweet(User author, String content, List<Long> mediaIds) {
        List<Long> requestedMedia = mediaIds != null ? mediaIds : List.of();
        log.debug("Creating tweet for user={}, contentLength={}, media={}",
            author.id(), content != null ? content.length() : 0, requestedMedia);

        // All referenced media must exist, otherwise nothing is written
        Set<Long> distinctIds = new LinkedHashSet<>(requestedMedia);
        Map<Long, Media> mediaById = distinctIds.isEmpty()
            ? Map.of()
            : mediaRepository.findByIds(distinctIds).stream()
                .collect(Collectors.toMap(Media::id, Function.identity()));

        List<Long> missing = distinctIds.stream()
            .filter(id -> !mediaById.containsKey(id))
            .toList();
        if (!missing.isEmpty()) {
            log.warn("Tweet rejected for user={}: unknown media {}", author.id(), missing);
            return Result.failure(new TweetError.MediaNotFound(missing));
        }

        // Snapshot paths in the caller's order, duplicates included
        List<String> attachments = requestedMedia.stream()
            .map(id -> mediaById.get(id).path())
            .toList();

        // Rejected content must not consume a sequence value
        var contentResult = Tweet.validateContent(content);
        if (contentResult.isFailure()) {
            log.warn("Tweet validation failed for user={}: {}", author.id(), contentResult.errorOrNull().message());
            return Result.failure(new TweetError.ValidationFailed(contentResult.errorOrNull()));
        }

        long tweetId = idGenerator.nextTweetId();
        Tweet tweet = new Tweet(tweetId, author.id(), contentResult.getOrThrow(), attachments);
        tweetRepository.save(tweet);

        metrics.incrementTweetsCreated();
        log.info("Tweet created: tweetId={}, userId={}, chars={}, attachments={}",
            tweetId, author.id(), tweet.content().codePointCount(0, tweet.content().length()), attachments.size());

        return Result.success(tweet);
    }

    @Override
    @Transactional
    public Result<Void, TweetError> deleteTweet(User caller, long tweetId) {
        log.debug("Processing delete request: tweetId={}, caller={}", tweetId, caller.id());

        Optional<Tweet> tweet = tweetRepository.findById(tweetId);
        if (tweet.isEmpty()) {
            log.debug("Tweet not found: tweetId={}", tweetId);
            return Result.failure(new TweetError.TweetNotFound(tweetId));
        }

        // Ownership is decided by the credential, not by the id
        String ownerApiKey = userRepository.findById(tweet.get().userId())
            .map(User::apiKey)
            .orElseThrow(() -> new IllegalStateException("Tweet " + tweetId + " has no owner row"));
        if (!ownerApiKey.equals(caller.apiKey())) {
            log.warn("Delete forbidden: tweetId={}, owner={}, caller={}", tweetId, tweet.get().userId(), caller.id());
            return Result.failure(new TweetError.NotOwner(tweetId));
        }

        int likesRemoved = likeRepository.deleteByTweetId(tweetId);
        tweetRepository.delete(tweetId);

        metrics.incrementTweetsDeleted();
        log.info("Tweet deleted: tweetId={}, userId={}, likesRemoved={}", tweetId, caller.id(), likesRemoved);

        return Result.ok();
    }
}
