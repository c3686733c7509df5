package com.microblog.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.microblog.application.port.in.CreateTweetUseCase;
import com.microblog.application.port.in.DeleteTweetUseCase;
import com.microblog.domain.error.TweetError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.Tweet;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Tweets", description = "Tweet operations")
public class TweetController {

    private final CreateTweetUseCase createTweetUseCase;
    private final DeleteTweetUseCase deleteTweetUseCase;

    public TweetController(CreateTweetUseCase createTweetUseCase, DeleteTweetUseCase deleteTweetUseCase) {
        this.createTweetUseCase = createTweetUseCase;
        this.deleteTweetUseCase = deleteTweetUseCase;
    }

    @PostMapping("/tweets")
    @Operation(summary = "Create a new tweet",
        description = "Creates a tweet for the authenticated user (max 280 characters), attaching previously uploaded media")
    public ResponseEntity<?> createTweet(@Valid @RequestBody CreateTweetRequest request) {
        Result<Tweet, TweetError> result = createTweetUseCase.createTweet(
            RequestContext.getUser(),
            request.tweetData(),
            request.tweetMediaIds()
        );

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(new CreateTweetResponse(true, result.getOrThrow().id()))
            : ErrorResponse.toResponseEntity(result.errorOrNull());
    }

    @DeleteMapping("/tweets/{tweetId}")
    @Operation(summary = "Delete a tweet", description = "Only the author may delete a tweet; its likes go with it")
    public ResponseEntity<?> deleteTweet(
            @Parameter(description = "Tweet ID", example = "1")
            @PathVariable long tweetId) {

        Result<Void, TweetError> result = deleteTweetUseCase.deleteTweet(RequestContext.getUser(), tweetId);

        return result.isSuccess()
            ? ResponseEntity.ok(SuccessResponse.OK)
            : ErrorResponse.toResponseEntity(result.errorOrNull());
    }

    public record CreateTweetRequest(
        @JsonProperty("tweet_data") @NotNull String tweetData,
        @JsonProperty("tweet_media_ids") List<Long> tweetMediaIds
    ) {}

    public record CreateTweetResponse(
        @JsonProperty("result") boolean result,
        @JsonProperty("tweet_id") long tweetId
    ) {}
}
