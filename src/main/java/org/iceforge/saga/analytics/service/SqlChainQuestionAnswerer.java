package org.iceforge.saga.analytics.service;

import org.iceforge.saga.analytics.config.SagaProperties;
import org.iceforge.saga.analytics.model.DatasetSchema;
import org.iceforge.saga.analytics.service.WarehouseQueryExecutor.QueryResult;
import org.iceforge.saga.analytics.service.llm.ChatMessage;
import org.iceforge.saga.analytics.service.llm.GenerationOptions;
import org.iceforge.saga.analytics.service.llm.TextGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Text-to-SQL chain: generate one SELECT over the dataset, guard it, run it with a row cap,
 * then have the model phrase a short answer from the rows.
 */
@Service
public class SqlChainQuestionAnswerer implements QuestionAnswerer {

    private static final Logger log = LoggerFactory.getLogger(SqlChainQuestionAnswerer.class);

    static final int MAX_ERROR_LENGTH = 200;

    private static final GenerationOptions SQL_OPTIONS = new GenerationOptions(0.0, 500);
    private static final GenerationOptions ANSWER_OPTIONS = new GenerationOptions(0.0, 300);

    private final TextGenerator generator;
    private final ReadOnlyQueryGuard guard;
    private final WarehouseQueryExecutor executor;
    private final DatasetSchemaLoader schemaLoader;
    private final SagaProperties.Answerer limits;

    public SqlChainQuestionAnswerer(TextGenerator generator,
                                    ReadOnlyQueryGuard guard,
                                    WarehouseQueryExecutor executor,
                                    DatasetSchemaLoader schemaLoader,
                                    SagaProperties props) {
        this.generator = Objects.requireNonNull(generator);
        this.guard = Objects.requireNonNull(guard);
        this.executor = Objects.requireNonNull(executor);
        this.schemaLoader = Objects.requireNonNull(schemaLoader);
        this.limits = Objects.requireNonNull(props.getAnswerer());
    }

    @Override
    public SubAnswer answer(String question) {
        try {
            DatasetSchema ds = schemaLoader.load();
            String generated = generator.complete(List.of(
                    ChatMessage.system("""
                            You write a single PostgreSQL SELECT statement that answers the user's question.
                            Use only this table and these columns:
                            %s
                            Rules:
                            - Output only the SQL, no explanation.
                            - Reference the table name unquoted and every column double-quoted.
                            - Aggregate where it makes sense and add LIMIT %d.
                            - Never modify data.
                            """.formatted(SchemaDescriber.describe(ds), limits.getMaxRows())),
                    ChatMessage.user(question)), SQL_OPTIONS);

            String sql = guard.check(generated);
            log.debug("Sub-question SQL: {}", sql);
            QueryResult result = executor.query(sql, limits.getMaxRows(), limits.getQueryTimeoutSeconds());

            String answer = generator.complete(List.of(
                    ChatMessage.system("Answer the question in one or two factual sentences using only the query result."),
                    ChatMessage.user("Question:\n" + question + "\n\nSQL:\n" + sql
                            + "\n\nResult:\n" + formatAsMarkdownTable(ResultSanitizer.cleanRows(result.rows())))),
                    ANSWER_OPTIONS);
            return SubAnswer.ok(answer.trim());
        } catch (RuntimeException e) {
            log.warn("Sub-question failed: {}", e.getMessage());
            return SubAnswer.error(errorText(e));
        }
    }

    static String errorText(Throwable e) {
        String msg = "Error: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        return msg.length() <= MAX_ERROR_LENGTH ? msg : msg.substring(0, MAX_ERROR_LENGTH);
    }

    static String formatAsMarkdownTable(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) return "(no rows)";
        List<String> cols = List.copyOf(rows.get(0).keySet());

        StringBuilder sb = new StringBuilder("| ");
        for (String c : cols) sb.append(c).append(" | ");
        sb.append("\n| ");
        for (int i = 0; i < cols.size(); i++) sb.append("--- | ");
        sb.append('\n');
        for (Map<String, Object> r : rows) {
            sb.append("| ");
            for (String c : cols) sb.append(r.get(c)).append(" | ");
            sb.append('\n');
        }
        return sb.toString();
    }
}
