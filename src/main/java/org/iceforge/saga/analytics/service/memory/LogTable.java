package org.iceforge.saga.analytics.service.memory;

import org.iceforge.saga.analytics.model.ChatExchange;
import org.iceforge.saga.analytics.model.SubQuestionTrace;
import org.iceforge.saga.analytics.model.VisualizationDigest;
import org.iceforge.saga.analytics.model.VisualizationTrace;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Function;

/**
 * One append-only log: its table, its payload columns and how records map to and from rows.
 * Every table also carries a store-assigned {@code id} and {@code created_at}.
 */
public final class LogTable<T> {

    public static final LogTable<ChatExchange> CHAT = new LogTable<>(
            "chat_history",
            List.of("user_message", "assistant_response"),
            List.of("TEXT", "TEXT"),
            (rs, i) -> new ChatExchange(rs.getString("user_message"), rs.getString("assistant_response"), createdAt(rs)),
            r -> new Object[]{r.userMessage(), r.assistantResponse()});

    public static final LogTable<SubQuestionTrace> SUB_QUESTIONS = new LogTable<>(
            "sql_queries",
            List.of("overarching_question", "sub_question", "sql_result", "success"),
            List.of("TEXT", "TEXT", "TEXT", "BOOLEAN"),
            (rs, i) -> new SubQuestionTrace(rs.getString("overarching_question"), rs.getString("sub_question"),
                    rs.getString("sql_result"), rs.getBoolean("success"), createdAt(rs)),
            r -> new Object[]{r.overarchingQuestion(), r.subQuestion(), r.sqlResult(), r.success()});

    public static final LogTable<VisualizationTrace> VISUALIZATIONS = new LogTable<>(
            "graph_queries",
            List.of("user_input_question", "queries"),
            List.of("TEXT", "TEXT"),
            (rs, i) -> new VisualizationTrace(rs.getString("user_input_question"), rs.getString("queries"), createdAt(rs)),
            r -> new Object[]{r.userInputQuestion(), r.queries()});

    public static final LogTable<VisualizationDigest> VISUALIZATION_DIGEST = new LogTable<>(
            "graph_memory",
            List.of("user_input", "sub_questions"),
            List.of("TEXT", "TEXT"),
            (rs, i) -> new VisualizationDigest(rs.getString("user_input"), rs.getString("sub_questions"), createdAt(rs)),
            r -> new Object[]{r.userInput(), r.subQuestions()});

    public static final List<LogTable<?>> ALL = List.of(CHAT, SUB_QUESTIONS, VISUALIZATIONS, VISUALIZATION_DIGEST);

    private final String name;
    private final List<String> columns;
    private final List<String> columnTypes;
    private final RowMapper<T> rowMapper;
    private final Function<T, Object[]> toArgs;

    private LogTable(String name, List<String> columns, List<String> columnTypes,
                     RowMapper<T> rowMapper, Function<T, Object[]> toArgs) {
        this.name = name;
        this.columns = columns;
        this.columnTypes = columnTypes;
        this.rowMapper = rowMapper;
        this.toArgs = toArgs;
    }

    public String name() {
        return name;
    }

    String createSql() {
        StringBuilder sb = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(name).append(" (")
                .append("id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, ");
        for (int i = 0; i < columns.size(); i++) {
            sb.append(columns.get(i)).append(' ').append(columnTypes.get(i)).append(", ");
        }
        return sb.append("created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)").toString();
    }

    String insertSql() {
        return "INSERT INTO " + name + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", columns.stream().map(c -> "?").toList()) + ")";
    }

    String recentSql() {
        return "SELECT " + String.join(", ", columns) + ", created_at FROM " + name
                + " ORDER BY created_at DESC, id DESC LIMIT ?";
    }

    RowMapper<T> rowMapper() {
        return rowMapper;
    }

    Object[] args(T record) {
        return toArgs.apply(record);
    }

    private static LocalDateTime createdAt(ResultSet rs) throws SQLException {
        Timestamp ts = rs.getTimestamp("created_at");
        return ts == null ? null : ts.toLocalDateTime();
    }

    @Override
    public String toString() {
        return name;
    }
}
