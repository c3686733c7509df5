package com.microblog.infrastructure.id;

import com.microblog.application.port.out.IdGenerator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Allocates ids from the PostgreSQL sequences that back the {@code tweets} and {@code medias} tables.
 */
@Component
public class SequenceIdGenerator implements IdGenerator {

    private static final String TWEET_SEQUENCE = "tweets_id_seq";
    private static final String MEDIA_SEQUENCE = "medias_id_seq";

    private final JdbcTemplate jdbc;

    public SequenceIdGenerator(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public long nextTweetId() {
        return next(TWEET_SEQUENCE);
    }

    @Override
    public long nextMediaId() {
        return next(MEDIA_SEQUENCE);
    }

    private long next(String sequence) {
        Long id = jdbc.queryForObject("SELECT nextval(?::regclass)", Long.class, sequence);
        if (id == null) {
            throw new IllegalStateException("Sequence " + sequence + " returned no value");
        }
        return id;
    }
}
