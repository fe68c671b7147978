package quest.gekko.smm.service.core;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Owns the operational schema. Tables are created when absent; data written by an older
 * revision is upgraded by adding the missing columns with their documented default.
 * Adding columns is the only in-place migration performed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaManager {

    private static final List<String> TABLES = List.of(
            """
            CREATE TABLE IF NOT EXISTS platforms (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                name VARCHAR(64) NOT NULL,
                code VARCHAR(32) NOT NULL UNIQUE,
                description VARCHAR(255),
                created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )""",
            """
            CREATE TABLE IF NOT EXISTS users (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                platform_id BIGINT NOT NULL REFERENCES platforms(id),
                user_id VARCHAR(255) NOT NULL,
                username VARCHAR(255),
                user_identity VARCHAR(64) DEFAULT '0' NOT NULL,
                avatar VARCHAR(1024) DEFAULT '',
                is_active BOOLEAN DEFAULT TRUE NOT NULL,
                created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                CONSTRAINT uk_users_platform_user UNIQUE (platform_id, user_id)
            )""",
            // user_id carries no foreign key: snapshots may outlive their account
            """
            CREATE TABLE IF NOT EXISTS follower_records (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                user_id BIGINT NOT NULL,
                platform_id BIGINT NOT NULL,
                user_identity VARCHAR(64) DEFAULT '0' NOT NULL,
                follower_count BIGINT NOT NULL CHECK (follower_count >= 0),
                record_time TIMESTAMP NOT NULL,
                status VARCHAR(32) DEFAULT 'success' NOT NULL,
                error_message VARCHAR,
                created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )""",
            """
            CREATE TABLE IF NOT EXISTS schedule_tasks (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                task_name VARCHAR(128) NOT NULL UNIQUE,
                platform_id BIGINT NOT NULL REFERENCES platforms(id),
                schedule_time VARCHAR(5) NOT NULL,
                is_enabled BOOLEAN DEFAULT TRUE NOT NULL,
                last_run_time TIMESTAMP,
                next_run_time TIMESTAMP,
                retry_count INT DEFAULT 0 NOT NULL,
                max_retry INT DEFAULT 3 NOT NULL,
                status VARCHAR(32) DEFAULT 'idle' NOT NULL,
                created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                updated_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )""",
            """
            CREATE TABLE IF NOT EXISTS task_logs (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                task_id BIGINT NOT NULL,
                start_time TIMESTAMP NOT NULL,
                end_time TIMESTAMP,
                status VARCHAR(32) NOT NULL,
                records_count INT DEFAULT 0 NOT NULL,
                success_count INT DEFAULT 0 NOT NULL,
                failed_count INT DEFAULT 0 NOT NULL,
                error_message VARCHAR,
                created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
            )""",
            "CREATE INDEX IF NOT EXISTS idx_follower_records_user_time ON follower_records(user_id, record_time)",
            "CREATE INDEX IF NOT EXISTS idx_follower_records_identity ON follower_records(user_identity)",
            "CREATE INDEX IF NOT EXISTS idx_task_logs_task ON task_logs(task_id, start_time)"
    );

    static final List<ColumnMigration> MIGRATIONS = List.of(
            new ColumnMigration("users", "user_identity", "VARCHAR(64) DEFAULT '0' NOT NULL", "'0'"),
            new ColumnMigration("users", "avatar", "VARCHAR(1024) DEFAULT ''", "''"),
            new ColumnMigration("users", "is_active", "BOOLEAN DEFAULT TRUE NOT NULL", "TRUE"),
            new ColumnMigration("follower_records", "user_identity", "VARCHAR(64) DEFAULT '0' NOT NULL", "'0'"),
            new ColumnMigration("follower_records", "status", "VARCHAR(32) DEFAULT 'success' NOT NULL", "'success'"),
            new ColumnMigration("schedule_tasks", "max_retry", "INT DEFAULT 3 NOT NULL", "3")
    );

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void ensureSchema() {
        TABLES.forEach(jdbcTemplate::execute);
        int added = 0;
        for (ColumnMigration migration : MIGRATIONS) {
            if (!columnExists(migration.table(), migration.column())) {
                addColumn(migration);
                added++;
            }
        }
        log.info("Schema ready ({} column(s) added)", added);
    }

    boolean columnExists(String table, String column) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM INFORMATION_SCHEMA.COLUMNS " +
                        "WHERE TABLE_SCHEMA = CURRENT_SCHEMA AND UPPER(TABLE_NAME) = UPPER(?) AND UPPER(COLUMN_NAME) = UPPER(?)",
                Integer.class, table, column);
        return count != null && count > 0;
    }

    private void addColumn(ColumnMigration migration) {
        log.warn("Upgrading schema: adding {}.{} ({})", migration.table(), migration.column(), migration.definition());
        jdbcTemplate.execute("ALTER TABLE " + migration.table() + " ADD COLUMN " + migration.column() + " " + migration.definition());
        int backfilled = jdbcTemplate.update("UPDATE " + migration.table() + " SET " + migration.column() + " = "
                + migration.backfill() + " WHERE " + migration.column() + " IS NULL");
        log.info("Back-filled {} row(s) of {}.{}", backfilled, migration.table(), migration.column());
    }

    record ColumnMigration(String table, String column, String definition, String backfill) {}
}
