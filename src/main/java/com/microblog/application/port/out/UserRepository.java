package com.microblog.application.port.out;

import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

import java.util.Optional;

public interface UserRepository {

    /**
     * Inserts a user unless the name or api key is already taken.
     *
     * @return true if a row was inserted
     */
    boolean createIfAbsent(String name, String apiKey);

    Optional<User> findById(UserId id);

    Optional<User> findByApiKey(String apiKey);

    boolean exists(UserId id);

    long count();
}
