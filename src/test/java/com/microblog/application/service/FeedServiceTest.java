package com.microblog.application.service;

import com.microblog.application.port.out.FollowRepository;
import com.microblog.application.port.out.LikeRepository;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.TweetRepository;
import com.microblog.application.port.out.TweetRepository.AuthoredTweet;
import com.microblog.domain.model.FeedTweet;
import com.microblog.domain.model.Tweet;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FeedService")
class FeedServiceTest {

    private static final User VIEWER = new User(UserId.of(1), "viewer", "k1");
    private static final UserSummary FRIEND = new UserSummary(UserId.of(2), "friend");
    private static final UserSummary OTHER = new UserSummary(UserId.of(3), "other");
    private static final UserSummary FAN = new UserSummary(UserId.of(4), "fan");

    @Mock
    private TweetRepository tweetRepository;

    @Mock
    private LikeRepository likeRepository;

    @Mock
    private FollowRepository followRepository;

    @Mock
    private MetricsPort metrics;

    private FeedService feedService;

    @BeforeEach
    void setUp() {
        feedService = new FeedService(tweetRepository, likeRepository, followRepository, metrics);
    }

    @Test
    @DisplayName("Should return empty feed when there are no tweets")
    void shouldReturnEmptyFeed() {
        when(tweetRepository.findAllWithAuthors()).thenReturn(List.of());

        List<FeedTweet> feed = feedService.getFeed(VIEWER);

        assertTrue(feed.isEmpty());
        verify(metrics).incrementFeedRequests();
        verifyNoInteractions(likeRepository, followRepository);
    }

    @Test
    @DisplayName("Should put tweets liked by followed users first")
    @SuppressWarnings("unchecked")
    void shouldRankByRelevantLikesThenCount() {
        // Given: tweet 1 has two likes from strangers, tweet 2 one like from a followed user
        when(tweetRepository.findAllWithAuthors()).thenReturn(List.of(
            authored(1, OTHER),
            authored(2, OTHER),
            authored(3, OTHER)
        ));
        when(likeRepository.findLikersByTweetIds(anyCollection())).thenReturn(Map.of(
            1L, List.of(OTHER, FAN),
            2L, List.of(FRIEND)
        ));
        when(followRepository.findFollowedIds(VIEWER.id())).thenReturn(List.of(FRIEND.id()));
        when(metrics.recordFeedRanking(any(Supplier.class)))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(0)).get());

        // When
        List<FeedTweet> feed = feedService.getFeed(VIEWER);

        // Then
        assertEquals(List.of(2L, 1L, 3L), feed.stream().map(t -> t.tweet().id()).toList());
        assertEquals(List.of(), feed.get(2).likes());
        assertEquals(OTHER, feed.get(0).author());
    }

    private static AuthoredTweet authored(long id, UserSummary author) {
        return new AuthoredTweet(new Tweet(id, author.id(), "tweet " + id, List.of()), author);
    }
}
