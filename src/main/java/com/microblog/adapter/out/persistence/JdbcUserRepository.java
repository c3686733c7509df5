package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JdbcUserRepository implements UserRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> new User(
        UserId.of(rs.getLong("id")),
        rs.getString("name"),
        rs.getString("api_key")
    );

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean createIfAbsent(String name, String apiKey) {
        return jdbc.update("""
            INSERT INTO users (name, api_key)
            VALUES (?, ?)
            ON CONFLICT DO NOTHING
            """,
            name,
            apiKey
        ) > 0;
    }

    @Override
    public Optional<User> findById(UserId id) {
        return jdbc.query(
            "SELECT id, name, api_key FROM users WHERE id = ?",
            ROW_MAPPER,
            id.value()
        ).stream().findFirst();
    }

    @Override
    public Optional<User> findByApiKey(String apiKey) {
        return jdbc.query(
            "SELECT id, name, api_key FROM users WHERE api_key = ?",
            ROW_MAPPER,
            apiKey
        ).stream().findFirst();
    }

    @Override
    public boolean exists(UserId id) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM users WHERE id = ?",
            Integer.class,
            id.value()
        );
        return count != null && count > 0;
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM users", Long.class);
        return count != null ? count : 0;
    }
}
