package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.TweetRepository;
import com.microblog.domain.model.Tweet;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserSummary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcTweetRepository implements TweetRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Tweet> ROW_MAPPER = (rs, rowNum) -> mapTweet(rs);

    private static final RowMapper<AuthoredTweet> AUTHORED_ROW_MAPPER = (rs, rowNum) -> new AuthoredTweet(
        mapTweet(rs),
        new UserSummary(UserId.of(rs.getLong("user_id")), rs.getString("author_name"))
    );

    public JdbcTweetRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Tweet tweet) {
        jdbc.update(con -> {
            var ps = con.prepareStatement(
                "INSERT INTO tweets (id, user_id, content, attachments) VALUES (?, ?, ?, ?)");
            ps.setLong(1, tweet.id());
            ps.setLong(2, tweet.userId().value());
            ps.setString(3, tweet.content());
            ps.setArray(4, con.createArrayOf("text", tweet.attachments().toArray()));
            return ps;
        });
    }

    @Override
    public Optional<Tweet> findById(long id) {
        return jdbc.query(
            "SELECT id, user_id, content, attachments FROM tweets WHERE id = ?",
            ROW_MAPPER,
            id
        ).stream().findFirst();
    }

    @Override
    public boolean exists(long id) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM tweets WHERE id = ?",
            Integer.class,
            id
        );
        return count != null && count > 0;
    }

    @Override
    public List<AuthoredTweet> findAllWithAuthors() {
        return jdbc.query("""
            SELECT t.id, t.user_id, t.content, t.attachments, u.name AS author_name
            FROM tweets t
            JOIN users u ON t.user_id = u.id
            ORDER BY t.id
            """,
            AUTHORED_ROW_MAPPER
        );
    }

    @Override
    public boolean delete(long id) {
        return jdbc.update("DELETE FROM tweets WHERE id = ?", id) > 0;
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM tweets", Long.class);
        return count != null ? count : 0;
    }

    private static Tweet mapTweet(ResultSet rs) throws SQLException {
        return new Tweet(
            rs.getLong("id"),
            UserId.of(rs.getLong("user_id")),
            rs.getString("content"),
            readAttachments(rs.getArray("attachments"))
        );
    }

    private static List<String> readAttachments(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        Object[] values = (Object[]) array.getArray();
        return Arrays.stream(values).map(String::valueOf).toList();
    }
}
