package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.MediaRepository;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public class JdbcMediaRepository implements MediaRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Media> ROW_MAPPER = (rs, rowNum) -> new Media(
        rs.getLong("id"),
        UserId.of(rs.getLong("user_id")),
        rs.getString("path")
    );

    public JdbcMediaRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Media media) {
        jdbc.update(
            "INSERT INTO medias (id, user_id, path) VALUES (?, ?, ?)",
            media.id(),
            media.userId().value(),
            media.path()
        );
    }

    @Override
    public List<Media> findByIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbc.query(con -> {
            var ps = con.prepareStatement("SELECT id, user_id, path FROM medias WHERE id = ANY (?)");
            ps.setArray(1, con.createArrayOf("bigint", ids.toArray()));
            return ps;
        }, ROW_MAPPER);
    }
}
