package com.microblog.application.port.out;

import java.util.function.Supplier;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementTweetsCreated();

    void incrementTweetsDeleted();

    void incrementLikes();

    void incrementUnlikes();

    void incrementFollows();

    void incrementUnfollows();

    void incrementMediaUploaded();

    void incrementFeedRequests();

    <T> T recordFeedRanking(Supplier<T> operation);
}
