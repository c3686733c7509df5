package com.microblog.adapter.in.web;

import com.microblog.application.port.in.LikeTweetUseCase;
import com.microblog.application.port.in.UnlikeTweetUseCase;
import com.microblog.domain.error.LikeError;
import com.microblog.domain.model.Result;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tweets/{tweetId}/likes")
@Tag(name = "Likes", description = "Like/unlike operations")
public class LikeController {

    private final LikeTweetUseCase likeTweetUseCase;
    private final UnlikeTweetUseCase unlikeTweetUseCase;

    public LikeController(LikeTweetUseCase likeTweetUseCase, UnlikeTweetUseCase unlikeTweetUseCase) {
        this.likeTweetUseCase = likeTweetUseCase;
        this.unlikeTweetUseCase = unlikeTweetUseCase;
    }

    @PostMapping
    @Operation(summary = "Like a tweet", description = "A user can like a tweet once")
    public ResponseEntity<?> like(
            @Parameter(description = "Tweet ID", example = "1")
            @PathVariable long tweetId) {

        Result<Void, LikeError> result = likeTweetUseCase.likeTweet(RequestContext.getUser(), tweetId);

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(SuccessResponse.OK)
            : ErrorResponse.toResponseEntity(result.errorOrNull());
    }

    @DeleteMapping
    @Operation(summary = "Remove a like")
    public ResponseEntity<?> unlike(
            @Parameter(description = "Tweet ID", example = "1")
            @PathVariable long tweetId) {

        Result<Void, LikeError> result = unlikeTweetUseCase.unlikeTweet(RequestContext.getUser(), tweetId);

        return result.isSuccess()
            ? ResponseEntity.ok(SuccessResponse.OK)
            : ErrorResponse.toResponseEntity(result.errorOrNull());
    }
}
