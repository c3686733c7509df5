package com.microblog.adapter.out.persistence;

import com.microblog.domain.model.Follow;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserSummary;
import com.microblog.integration.base.FullStackTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.dao.DuplicateKeyException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcFollowRepositoryTest extends FullStackTestBase {

    @Autowired
    private JdbcFollowRepository followRepository;

    @Autowired
    private JdbcUserRepository userRepository;

    private UserId alice;
    private UserId bob;
    private UserId charlie;

    @BeforeEach
    void setUpTestUsers() {
        // Create test users (database is cleaned by parent @BeforeEach)
        alice = createUser("alice");
        bob = createUser("bob");
        charlie = createUser("charlie");
    }

    @Test
    void shouldSaveDirectedFollowRelationship() {
        // When
        followRepository.save(Follow.create(alice, bob).getOrThrow());

        // Then
        assertEquals(List.of(bob), followRepository.findFollowedIds(alice));
        assertTrue(followRepository.findFollowedIds(bob).isEmpty());
    }

    @Test
    void shouldRejectDuplicateFollow() {
        // Given
        Follow follow = Follow.create(alice, bob).getOrThrow();
        followRepository.save(follow);

        // When / Then - the primary key is the duplicate detector
        assertThrows(DuplicateKeyException.class, () -> followRepository.save(follow));
        assertEquals(1, followRepository.count());
    }

    @Test
    void shouldDeleteFollowRelationship() {
        // Given
        followRepository.save(Follow.create(alice, bob).getOrThrow());

        // When
        boolean first = followRepository.delete(alice, bob);
        boolean second = followRepository.delete(alice, bob);

        // Then
        assertTrue(first);
        assertFalse(second);
        assertTrue(followRepository.findFollowing(alice).isEmpty());
    }

    @Test
    void shouldFindFollowingInIdOrder() {
        // Given
        followRepository.save(Follow.create(alice, charlie).getOrThrow());
        followRepository.save(Follow.create(alice, bob).getOrThrow());

        // When
        List<UserSummary> following = followRepository.findFollowing(alice);

        // Then
        assertEquals(List.of(new UserSummary(bob, "bob"), new UserSummary(charlie, "charlie")), following);
        assertEquals(List.of(bob, charlie), followRepository.findFollowedIds(alice));
    }

    @Test
    void shouldFindFollowers() {
        // Given
        followRepository.save(Follow.create(alice, bob).getOrThrow());
        followRepository.save(Follow.create(charlie, bob).getOrThrow());

        // When
        List<UserSummary> followers = followRepository.findFollowers(bob);

        // Then
        assertEquals(List.of(new UserSummary(alice, "alice"), new UserSummary(charlie, "charlie")), followers);
        assertTrue(followRepository.findFollowers(alice).isEmpty());
    }

    private UserId createUser(String name) {
        userRepository.createIfAbsent(name, name + "-key");
        return userRepository.findByApiKey(name + "-key").orElseThrow().id();
    }
}
