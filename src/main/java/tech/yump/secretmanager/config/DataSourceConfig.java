package tech.yump.secretmanager.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Builds the Hikari pool for the {@code secret} table from {@code secretmanager.database}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataSourceConfig {

    static final String POOL_NAME = "SecretManagerPostgresPool";

    private final SecretManagerProperties properties;

    @Bean
    @Primary
    public DataSource dataSource() {
        SecretManagerProperties.DatabaseProperties db = properties.database();
        if (db == null) {
            throw new IllegalStateException("Missing database configuration (secretmanager.database).");
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(db.connectionUrl());
        config.setUsername(db.username());
        char[] password = db.password();
        if (password != null && password.length > 0) {
            // Hikari only takes a String
            config.setPassword(new String(password));
        } else {
            log.warn("No database password configured (secretmanager.database.password); connecting without one.");
        }
        config.setDriverClassName("org.postgresql.Driver");
        config.setPoolName(POOL_NAME);
        config.setMaximumPoolSize(10);
        config.setMinimumIdle(2);

        log.info("Creating HikariDataSource for URL: {}, User: {}", config.getJdbcUrl(), config.getUsername());
        return new HikariDataSource(config);
    }
}
