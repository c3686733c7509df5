package com.microblog.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.microblog.application.port.in.GetFeedUseCase;
import com.microblog.domain.model.FeedTweet;
import com.microblog.domain.model.UserSummary;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Feed", description = "Ranked feed")
public class FeedController {

    private final GetFeedUseCase getFeedUseCase;

    public FeedController(GetFeedUseCase getFeedUseCase) {
        this.getFeedUseCase = getFeedUseCase;
    }

    @GetMapping("/tweets")
    @Operation(summary = "Get the feed",
        description = "All tweets; those liked by the caller or someone they follow first, then by like count")
    public ResponseEntity<FeedResponse> getFeed() {
        List<FeedTweet> feed = getFeedUseCase.getFeed(RequestContext.getUser());
        return ResponseEntity.ok(new FeedResponse(true, feed.stream().map(FeedTweetResponse::from).toList()));
    }

    public record FeedResponse(
        @JsonProperty("result") boolean result,
        @JsonProperty("tweets") List<FeedTweetResponse> tweets
    ) {}

    public record FeedTweetResponse(
        @JsonProperty("id") long id,
        @JsonProperty("content") String content,
        @JsonProperty("attachments") List<String> attachments,
        @JsonProperty("author") UserSummaryResponse author,
        @JsonProperty("likes") List<LikeResponse> likes
    ) {
        public static FeedTweetResponse from(FeedTweet tweet) {
            return new FeedTweetResponse(
                tweet.tweet().id(),
                tweet.tweet().content(),
                tweet.tweet().attachments(),
                UserSummaryResponse.from(tweet.author()),
                tweet.likes().stream().map(LikeResponse::from).toList()
            );
        }
    }

    public record LikeResponse(
        @JsonProperty("user_id") long userId,
        @JsonProperty("name") String name
    ) {
        public static LikeResponse from(UserSummary user) {
            return new LikeResponse(user.id().value(), user.name());
        }
    }
}
