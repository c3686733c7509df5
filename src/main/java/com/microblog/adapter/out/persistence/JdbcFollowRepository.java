package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.FollowRepository;
import com.microblog.domain.model.Follow;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserSummary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public class JdbcFollowRepository implements FollowRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<UserSummary> USER_SUMMARY_ROW_MAPPER = (rs, rowNum) -> new UserSummary(
        UserId.of(rs.getLong("id")),
        rs.getString("name")
    );

    public JdbcFollowRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    // Savepoint, so a duplicate-key failure does not poison the caller's transaction
    @Override
    @Transactional(propagation = Propagation.NESTED)
    public void save(Follow follow) {
        jdbc.update(
            "INSERT INTO follows (follower_id, followed_id) VALUES (?, ?)",
            follow.followerId().value(),
            follow.followedId().value()
        );
    }

    @Override
    public boolean delete(UserId followerId, UserId followedId) {
        return jdbc.update(
            "DELETE FROM follows WHERE follower_id = ? AND followed_id = ?",
            followerId.value(),
            followedId.value()
        ) > 0;
    }

    @Override
    public List<UserSummary> findFollowers(UserId userId) {
        return jdbc.query("""
            SELECT u.id, u.name
            FROM follows f
            JOIN users u ON f.follower_id = u.id
            WHERE f.followed_id = ?
            ORDER BY u.id
            """,
            USER_SUMMARY_ROW_MAPPER,
            userId.value()
        );
    }

    @Override
    public List<UserSummary> findFollowing(UserId userId) {
        return jdbc.query("""
            SELECT u.id, u.name
            FROM follows f
            JOIN users u ON f.followed_id = u.id
            WHERE f.follower_id = ?
            ORDER BY u.id
            """,
            USER_SUMMARY_ROW_MAPPER,
            userId.value()
        );
    }

    @Override
    public List<UserId> findFollowedIds(UserId userId) {
        return jdbc.queryForList(
            "SELECT followed_id FROM follows WHERE follower_id = ? ORDER BY followed_id",
            Long.class,
            userId.value()
        ).stream().map(UserId::of).toList();
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM follows", Long.class);
        return count != null ? count : 0;
    }
}
