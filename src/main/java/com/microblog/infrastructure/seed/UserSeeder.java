package com.microblog.infrastructure.seed;

import com.microblog.application.port.out.UserRepository;
import com.microblog.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Inserts the accounts listed under {@code app.seed.users} when they are missing.
 */
@Component
public class UserSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(UserSeeder.class);

    private final UserRepository userRepository;
    private final AppProperties appProperties;

    public UserSeeder(UserRepository userRepository, AppProperties appProperties) {
        this.userRepository = userRepository;
        this.appProperties = appProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        int created = 0;
        for (AppProperties.SeedUser user : appProperties.getSeed().getUsers()) {
            if (userRepository.createIfAbsent(user.getName(), user.getApiKey())) {
                created++;
                log.info("Seeded user: name={}", user.getName());
            }
        }
        log.info("User seeding complete: created={}, total={}", created, userRepository.count());
    }
}
