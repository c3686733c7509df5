package com.microblog.adapter.in.web;

import com.microblog.application.port.in.FollowUserUseCase;
import com.microblog.application.port.in.ResolveIdentityUseCase;
import com.microblog.application.port.in.UnfollowUserUseCase;
import com.microblog.domain.error.FollowError;
import com.microblog.domain.error.IdentityError;
import com.microblog.domain.error.ValidationError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(FollowController.class)
class FollowControllerTest {

    private static final User ALICE = new User(UserId.of(1), "alice", "alice-key");
    private static final UserId BOB = UserId.of(2);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FollowUserUseCase followUserUseCase;

    @MockBean
    private UnfollowUserUseCase unfollowUserUseCase;

    @MockBean
    private ResolveIdentityUseCase resolveIdentityUseCase;

    @BeforeEach
    void authenticate() {
        when(resolveIdentityUseCase.resolve(any())).thenReturn(Result.failure(IdentityError.MissingApiKey.INSTANCE));
        when(resolveIdentityUseCase.resolve("alice-key")).thenReturn(Result.success(ALICE));
    }

    @Test
    void shouldFollow() throws Exception {
        when(followUserUseCase.followUser(ALICE, BOB)).thenReturn(Result.ok());

        mockMvc.perform(post("/api/users/2/follow").header("api-key", "alice-key"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.result").value(true));
    }

    @Test
    void shouldReturnConflictWhenAlreadyFollowing() throws Exception {
        when(followUserUseCase.followUser(ALICE, BOB))
            .thenReturn(Result.failure(new FollowError.AlreadyFollowing(ALICE.id(), BOB)));

        mockMvc.perform(post("/api/users/2/follow").header("api-key", "alice-key"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_type").value("FollowError"));
    }

    @Test
    void shouldRejectSelfFollow() throws Exception {
        when(followUserUseCase.followUser(ALICE, ALICE.id()))
            .thenReturn(Result.failure(new FollowError.ValidationFailed(
                ValidationError.FollowValidationError.SelfFollow.INSTANCE)));

        mockMvc.perform(post("/api/users/1/follow").header("api-key", "alice-key"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_type").value("FollowError"));
    }

    @Test
    void shouldReturnNotFoundForUnknownTarget() throws Exception {
        UserId ghost = UserId.of(999);
        when(followUserUseCase.followUser(ALICE, ghost))
            .thenReturn(Result.failure(new FollowError.TargetNotFound(ghost)));

        mockMvc.perform(post("/api/users/999/follow").header("api-key", "alice-key"))
            .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectInvalidTargetId() throws Exception {
        mockMvc.perform(post("/api/users/abc/follow").header("api-key", "alice-key"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_type").value("ValidationError"));

        verifyNoInteractions(followUserUseCase);
    }

    @Test
    void shouldUnfollow() throws Exception {
        when(unfollowUserUseCase.unfollow(ALICE, BOB)).thenReturn(Result.ok());

        mockMvc.perform(delete("/api/users/2/follow").header("api-key", "alice-key"))
            .andExpect(status().isOk());
    }

    @Test
    void shouldRequireApiKey() throws Exception {
        mockMvc.perform(post("/api/users/2/follow"))
            .andExpect(status().isUnauthorized());

        verifyNoInteractions(followUserUseCase);
    }
}
