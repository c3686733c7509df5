package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.LikeRepository;
import com.microblog.domain.model.Like;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserSummary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
public class JdbcLikeRepository implements LikeRepository {

    private final JdbcTemplate jdbc;

    public JdbcLikeRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    @Transactional(propagation = Propagation.NESTED)
    public void save(Like like) {
        jdbc.update(
            "INSERT INTO likes (tweet_id, user_id) VALUES (?, ?)",
            like.tweetId(),
            like.userId().value()
        );
    }

    @Override
    public boolean delete(long tweetId, UserId userId) {
        return jdbc.update(
            "DELETE FROM likes WHERE tweet_id = ? AND user_id = ?",
            tweetId,
            userId.value()
        ) > 0;
    }

    @Override
    public int deleteByTweetId(long tweetId) {
        return jdbc.update("DELETE FROM likes WHERE tweet_id = ?", tweetId);
    }

    @Override
    public Map<Long, List<UserSummary>> findLikersByTweetIds(Collection<Long> tweetIds) {
        if (tweetIds.isEmpty()) {
            return Map.of();
        }

        Map<Long, List<UserSummary>> likers = new HashMap<>();
        jdbc.query(con -> {
            var ps = con.prepareStatement("""
                SELECT l.tweet_id, u.id, u.name
                FROM likes l
                JOIN users u ON l.user_id = u.id
                WHERE l.tweet_id = ANY (?)
                ORDER BY l.tweet_id, u.id
                """);
            ps.setArray(1, con.createArrayOf("bigint", tweetIds.toArray()));
            return ps;
        }, rs -> {
            likers.computeIfAbsent(rs.getLong("tweet_id"), k -> new ArrayList<>())
                .add(new UserSummary(UserId.of(rs.getLong("id")), rs.getString("name")));
        });
        return likers;
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM likes", Long.class);
        return count != null ? count : 0;
    }
}
