package quest.gekko.smm.service.credential;

import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import quest.gekko.smm.config.MonitorProperties;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the latest authentication token per platform in its own database file, apart from
 * the operational store. Failures are logged and reported through the return value.
 */
@Slf4j
@Service
public class CredentialStore {

    private final HikariDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;

    public CredentialStore(MonitorProperties properties) {
        this.dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(properties.getCredentials().getUrl())
                .username("sa")
                .password("")
                .build();
        this.dataSource.setPoolName("credentials");
        this.dataSource.setMaximumPoolSize(2);
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS cookies (
                    id BIGINT AUTO_INCREMENT PRIMARY KEY,
                    platform VARCHAR(32) NOT NULL UNIQUE,
                    cookie VARCHAR NOT NULL,
                    created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    updated_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
                )""");
        log.info("Credential store ready at {}", dataSource.getJdbcUrl());
    }

    /** Replaces the platform's token. {@code false} means the token is not guaranteed persisted. */
    public boolean save(String platform, String token) {
        if (!StringUtils.hasText(platform) || token == null) {
            log.warn("Refusing to save credential: platform or token missing");
            return false;
        }
        try {
            jdbcTemplate.update("MERGE INTO cookies (platform, cookie, updated_at) KEY (platform) VALUES (?, ?, ?)",
                    platform, token, Timestamp.valueOf(LocalDateTime.now()));
            log.info("Saved credential for {}", platform);
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to save credential for {}", platform, e);
            return false;
        }
    }

    public Optional<String> get(String platform) {
        try {
            List<String> tokens = jdbcTemplate.queryForList(
                    "SELECT cookie FROM cookies WHERE platform = ?", String.class, platform);
            return tokens.stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Failed to read credential for {}", platform, e);
            return Optional.empty();
        }
    }

    public boolean delete(String platform) {
        try {
            int rows = jdbcTemplate.update("DELETE FROM cookies WHERE platform = ?", platform);
            if (rows > 0) {
                log.info("Deleted credential for {}", platform);
            }
            return rows > 0;
        } catch (DataAccessException e) {
            log.error("Failed to delete credential for {}", platform, e);
            return false;
        }
    }

    public List<StoredCredential> list() {
        try {
            return jdbcTemplate.query("SELECT platform, created_at, updated_at FROM cookies ORDER BY platform",
                    (rs, rowNum) -> new StoredCredential(
                            rs.getString("platform"),
                            rs.getTimestamp("created_at").toLocalDateTime(),
                            rs.getTimestamp("updated_at").toLocalDateTime()));
        } catch (DataAccessException e) {
            log.error("Failed to list credentials", e);
            return List.of();
        }
    }

    @PreDestroy
    public void close() {
        dataSource.close();
    }
}
