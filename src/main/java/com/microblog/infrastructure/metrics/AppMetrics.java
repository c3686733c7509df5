package com.microblog.infrastructure.metrics;

import com.microblog.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter tweetsCreated;
    private final Counter tweetsDeleted;
    private final Counter likes;
    private final Counter unlikes;
    private final Counter follows;
    private final Counter unfollows;
    private final Counter mediaUploaded;
    private final Counter feedRequests;
    private final Timer feedRanking;

    public AppMetrics(MeterRegistry registry) {
        this.tweetsCreated = Counter.builder("tweets_created_total")
            .description("Total number of tweets created")
            .register(registry);

        this.tweetsDeleted = Counter.builder("tweets_deleted_total")
            .description("Total number of tweets deleted")
            .register(registry);

        this.likes = Counter.builder("likes_total")
            .description("Total number of likes")
            .register(registry);

        this.unlikes = Counter.builder("unlikes_total")
            .description("Total number of removed likes")
            .register(registry);

        this.follows = Counter.builder("follows_created_total")
            .description("Total number of follow actions")
            .register(registry);

        this.unfollows = Counter.builder("unfollows_total")
            .description("Total number of unfollow actions")
            .register(registry);

        this.mediaUploaded = Counter.builder("media_uploaded_total")
            .description("Total number of stored media files")
            .register(registry);

        this.feedRequests = Counter.builder("feed_requests_total")
            .description("Total number of feed requests")
            .register(registry);

        this.feedRanking = Timer.builder("feed_ranking_duration_seconds")
            .description("Time taken to rank the feed")
            .register(registry);
    }

    @Override
    public void incrementTweetsCreated() {
        tweetsCreated.increment();
    }

    @Override
    public void incrementTweetsDeleted() {
        tweetsDeleted.increment();
    }

    @Override
    public void incrementLikes() {
        likes.increment();
    }

    @Override
    public void incrementUnlikes() {
        unlikes.increment();
    }

    @Override
    public void incrementFollows() {
        follows.increment();
    }

    @Override
    public void incrementUnfollows() {
        unfollows.increment();
    }

    @Override
    public void incrementMediaUploaded() {
        mediaUploaded.increment();
    }

    @Override
    public void incrementFeedRequests() {
        feedRequests.increment();
    }

    @Override
    public <T> T recordFeedRanking(Supplier<T> operation) {
        return feedRanking.record(operation);
    }
}
