package com.polpas.orderbot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.File;

/**
 * SQLite file holding confirmed orders. JPA itself is configured by Spring Boot on top of
 * this data source.
 */
@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "com.polpas.orderbot.repository.order")
public class OrderDatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(OrderDatabaseConfig.class);

    @Bean
    public DataSource orderDataSource(@Value("${orderbot.datasource.path:data/orders.db}") String path,
                                      @Value("${orderbot.datasource.busy-timeout-ms:60000}") int busyTimeoutMs) {
        ensureParentDirectory(path);

        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(busyTimeoutMs);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + path);
        return dataSource;
    }

    private void ensureParentDirectory(String path) {
        File parent = new File(path).getAbsoluteFile().getParentFile();
        if (parent == null || parent.exists()) {
            return;
        }
        if (parent.mkdirs()) {
            logger.info("[OrderDatabaseConfig] Created data directory {}", parent);
        } else {
            logger.error("[OrderDatabaseConfig] Failed to create data directory {}", parent);
        }
    }
}
