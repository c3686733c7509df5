package com.microblog.domain.ranking;

import com.microblog.domain.model.FeedTweet;
import com.microblog.domain.model.UserId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Orders a viewer's feed.
 *
 * <p>Tweets are ranked descending by two keys:
 * <ol>
 *   <li>whether anyone in the viewer's relevant set (the viewer plus everyone they follow) liked it;</li>
 *   <li>the total number of likes.</li>
 * </ol>
 * There is no third key. The sort is stable, so tweets with equal keys keep the order they were
 * retrieved in.
 */
public final class FeedRanking {

    private FeedRanking() {}

    public static List<FeedTweet> rank(List<FeedTweet> tweets, Set<UserId> relevantUsers) {
        Comparator<FeedTweet> order = Comparator
            .comparing((FeedTweet tweet) -> tweet.isLikedByAnyOf(relevantUsers))
            .thenComparingInt(FeedTweet::likeCount)
            .reversed();

        // List.sort is a stable merge sort
        List<FeedTweet> ranked = new ArrayList<>(tweets);
        ranked.sort(order);
        return ranked;
    }

    /**
     * The viewer always counts as relevant, even when they follow no one.
     */
    public static Set<UserId> relevantUsers(UserId viewer, List<UserId> followedIds) {
        Set<UserId> relevant = new HashSet<>(followedIds);
        relevant.add(viewer);
        return relevant;
    }
}
