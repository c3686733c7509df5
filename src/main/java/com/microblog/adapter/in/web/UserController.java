package com.microblog.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.microblog.application.port.in.GetProfileUseCase;
import com.microblog.domain.error.IdentityError;
import com.microblog.domain.error.UserError;
import com.microblog.domain.model.Profile;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@Tag(name = "Users", description = "Profiles")
public class UserController {

    private final GetProfileUseCase getProfileUseCase;

    public UserController(GetProfileUseCase getProfileUseCase) {
        this.getProfileUseCase = getProfileUseCase;
    }

    @GetMapping("/me")
    @Operation(summary = "Get own profile")
    public ResponseEntity<?> getOwnProfile() {
        User caller = RequestContext.getUser();
        if (caller == null) {
            return ErrorResponse.toResponseEntity(IdentityError.MissingApiKey.INSTANCE);
        }
        return toResponse(getProfileUseCase.getProfile(caller.id()));
    }

    @GetMapping("/{userId}")
    @Operation(summary = "Get a profile by id", description = "Public; no api-key needed")
    public ResponseEntity<?> getProfile(
            @Parameter(description = "User ID", example = "1")
            @PathVariable String userId) {

        var userIdResult = UserId.parse(userId);
        if (userIdResult.isFailure()) {
            return ErrorResponse.toResponseEntity(userIdResult.errorOrNull());
        }

        return toResponse(getProfileUseCase.getProfile(userIdResult.getOrThrow()));
    }

    private ResponseEntity<?> toResponse(Result<Profile, UserError> result) {
        return result.isSuccess()
            ? ResponseEntity.ok(new ProfileResponse(true, UserResponse.from(result.getOrThrow())))
            : ErrorResponse.toResponseEntity(result.errorOrNull());
    }

    public record ProfileResponse(
        @JsonProperty("result") boolean result,
        @JsonProperty("user") UserResponse user
    ) {}

    public record UserResponse(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("followers") List<UserSummaryResponse> followers,
        @JsonProperty("following") List<UserSummaryResponse> following
    ) {
        public static UserResponse from(Profile profile) {
            return new UserResponse(
                profile.user().id().value(),
                profile.user().name(),
                profile.followers().stream().map(UserSummaryResponse::from).toList(),
                profile.following().stream().map(UserSummaryResponse::from).toList()
            );
        }
    }
}
