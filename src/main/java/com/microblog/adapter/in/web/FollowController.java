package com.microblog.adapter.in.web;

import com.microblog.application.port.in.FollowUserUseCase;
import com.microblog.application.port.in.UnfollowUserUseCase;
import com.microblog.domain.error.FollowError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;
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
@RequestMapping("/api/users")
@Tag(name = "Follows", description = "Follow/unfollow operations")
public class FollowController {

    private final FollowUserUseCase followUserUseCase;
    private final UnfollowUserUseCase unfollowUserUseCase;

    public FollowController(FollowUserUseCase followUserUseCase, UnfollowUserUseCase unfollowUserUseCase) {
        this.followUserUseCase = followUserUseCase;
        this.unfollowUserUseCase = unfollowUserUseCase;
    }

    @PostMapping("/{targetId}/follow")
    @Operation(summary = "Follow a user", description = "Make the current user follow the target user")
    public ResponseEntity<?> followUser(
            @Parameter(description = "Target User ID (to follow)", example = "2")
            @PathVariable String targetId) {

        var targetResult = UserId.parse(targetId);
        if (targetResult.isFailure()) {
            return ErrorResponse.toResponseEntity(targetResult.errorOrNull());
        }

        Result<Void, FollowError> result = followUserUseCase.followUser(RequestContext.getUser(), targetResult.getOrThrow());

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(SuccessResponse.OK)
            : ErrorResponse.toResponseEntity(result.errorOrNull());
    }

    @DeleteMapping("/{targetId}/follow")
    @Operation(summary = "Unfollow a user", description = "Make the current user unfollow the target user")
    public ResponseEntity<?> unfollowUser(
            @Parameter(description = "Target User ID (to unfollow)", example = "2")
            @PathVariable String targetId) {

        var targetResult = UserId.parse(targetId);
        if (targetResult.isFailure()) {
            return ErrorResponse.toResponseEntity(targetResult.errorOrNull());
        }

        Result<Void, FollowError> result = unfollowUserUseCase.unfollow(RequestContext.getUser(), targetResult.getOrThrow());

        return result.isSuccess()
            ? ResponseEntity.ok(SuccessResponse.OK)
            : ErrorResponse.toResponseEntity(result.errorOrNull());
    }
}
