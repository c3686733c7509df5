package com.microblog.infrastructure.config;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the single connection pool. Spring closes it on shutdown.
 */
@Configuration
public class DataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    private static final String POOL_NAME = "microblog-pool";

    private final DataSourceProperties dataSourceProperties;
    private final AppProperties appProperties;

    public DataSourceConfig(DataSourceProperties dataSourceProperties, AppProperties appProperties) {
        this.dataSourceProperties = dataSourceProperties;
        this.appProperties = appProperties;
    }

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource() {
        AppProperties.Database database = appProperties.getDatabase();

        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setJdbcUrl(dataSourceProperties.determineUrl());
        dataSource.setUsername(dataSourceProperties.determineUsername());
        dataSource.setPassword(dataSourceProperties.determinePassword());
        dataSource.setMaximumPoolSize(database.getMaxPoolSize());
        dataSource.setMinimumIdle(database.getMinIdle());
        dataSource.setPoolName(POOL_NAME);

        log.info("Configured datasource {} (maxPoolSize={}, minIdle={})",
            dataSourceProperties.determineUrl(), database.getMaxPoolSize(), database.getMinIdle());
        return dataSource;
    }
}
