package org.iceforge.saga.analytics.service.memory;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only conversation logs in the warehouse database. Reads are synchronous; appends go
 * through the {@link LogWriteChannel} and never fail the caller.
 */
@Service
public class ConversationMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationMemoryStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final LogWriteChannel channel;

    public ConversationMemoryStore(JdbcTemplate jdbcTemplate, LogWriteChannel channel) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate);
        this.channel = Objects.requireNonNull(channel);
    }

    /**
     * Best effort: a table that cannot be created is logged and skipped, so the service still starts.
     */
    @PostConstruct
    public void ensureTables() {
        int failed = 0;
        for (LogTable<?> table : LogTable.ALL) {
            try {
                jdbcTemplate.execute(table.createSql());
            } catch (DataAccessException e) {
                failed++;
                log.warn("Could not create log table {}: {}", table, e.getMostSpecificCause().getMessage());
            }
        }
        if (failed == 0) {
            log.info("Conversation log tables ready: {}", LogTable.ALL);
        } else {
            log.warn("{} of {} conversation log tables unavailable", failed, LogTable.ALL.size());
        }
    }

    /**
     * The most recent {@code limit} entries of a log, oldest first.
     */
    public <T> List<T> recent(LogTable<T> table, int limit) {
        if (limit <= 0) return List.of();
        List<T> rows = new ArrayList<>(jdbcTemplate.query(table.recentSql(), table.rowMapper(), limit));
        Collections.reverse(rows);
        return rows;
    }

    public <T> void append(LogTable<T> table, T record) {
        Object[] args = table.args(record);
        channel.submit("append to " + table.name(), () -> jdbcTemplate.update(table.insertSql(), args));
    }
}
