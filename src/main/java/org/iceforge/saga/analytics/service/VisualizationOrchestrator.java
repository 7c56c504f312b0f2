package org.iceforge.saga.analytics.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.saga.analytics.config.SagaProperties;
import org.iceforge.saga.analytics.model.*;
import org.iceforge.saga.analytics.service.WarehouseQueryExecutor.QueryResult;
import org.iceforge.saga.analytics.service.llm.ChatMessage;
import org.iceforge.saga.analytics.service.llm.GenerationOptions;
import org.iceforge.saga.analytics.service.llm.TextGenerator;
import org.iceforge.saga.analytics.service.memory.ConversationMemoryStore;
import org.iceforge.saga.analytics.service.memory.LogTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns a question into a handful of charts: the model proposes chart specs with SQL, each
 * spec is guarded, executed and shaped independently, and a failing chart never takes the
 * others down with it.
 */
@Service
public class VisualizationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(VisualizationOrchestrator.class);

    static final int MAX_SQL_ERROR_LENGTH = 300;
    static final int DIGEST_LINES = 5;
    static final String DIGEST_DISCLAIMER = "DISCLAIMER: Generated visualization sub-questions. Use with caution.\n\n";

    private static final GenerationOptions SPEC_OPTIONS = GenerationOptions.of(0.2, 1500);

    private final ConversationMemoryStore memory;
    private final TextGenerator generator;
    private final ChartSpecParser parser;
    private final ReadOnlyQueryGuard guard;
    private final WarehouseQueryExecutor executor;
    private final DatasetSchemaLoader schemaLoader;
    private final SagaProperties props;

    public VisualizationOrchestrator(ConversationMemoryStore memory,
                                     TextGenerator generator,
                                     ChartSpecParser parser,
                                     ReadOnlyQueryGuard guard,
                                     WarehouseQueryExecutor executor,
                                     DatasetSchemaLoader schemaLoader,
                                     SagaProperties props) {
        this.memory = Objects.requireNonNull(memory);
        this.generator = Objects.requireNonNull(generator);
        this.parser = Objects.requireNonNull(parser);
        this.guard = Objects.requireNonNull(guard);
        this.executor = Objects.requireNonNull(executor);
        this.schemaLoader = Objects.requireNonNull(schemaLoader);
        this.props = Objects.requireNonNull(props);
    }

    public Visualization generate(String question) {
        if (question == null || question.isBlank()) {
            throw new AnalyticsValidationException("user_message must not be blank");
        }
        String q = question.trim();
        DatasetSchema ds = schemaLoader.load();

        String raw = generator.complete(List.of(
                ChatMessage.system(specPrompt(ds, props.getMaxCharts())),
                ChatMessage.user(q)), SPEC_OPTIONS);

        List<JsonNode> specs = parser.parse(raw);
        if (specs.size() > props.getMaxCharts()) {
            log.warn("Model proposed {} charts; ignoring all but the first {}", specs.size(), props.getMaxCharts());
            specs = specs.subList(0, props.getMaxCharts());
        }
        log.info("Rendering {} chart specs", specs.size());

        List<ChartResult> charts = new ArrayList<>(specs.size());
        List<String> traceLines = new ArrayList<>(specs.size());
        for (JsonNode node : specs) {
            if (!node.isObject()) {
                charts.add(ChartResult.error("Chart", "Chart spec is not a JSON object"));
                traceLines.add("Chart (error)");
                continue;
            }
            ChartSpec spec = toSpec(node);
            charts.add(render(spec));
            traceLines.add(spec.title() + " (" + spec.chartType() + ")");
        }

        String questionsText = String.join("\n", traceLines);
        memory.append(LogTable.VISUALIZATIONS, new VisualizationTrace(q, questionsText, null));
        memory.append(LogTable.VISUALIZATION_DIGEST, new VisualizationDigest(q, digest(questionsText), null));

        long ok = charts.stream().filter(c -> !c.failed()).count();
        log.info("Returning {} charts ({} successful)", charts.size(), ok);
        return new Visualization(charts, questionsText);
    }

    ChartResult render(ChartSpec spec) {
        String title = spec.title();
        String sql;
        try {
            sql = guard.check(spec.sql());
        } catch (QueryRejectedException e) {
            log.warn("Rejected SQL for '{}': {}", title, e.getMessage());
            return ChartResult.error(title, e.getMessage());
        }

        QueryResult result;
        try {
            SagaProperties.Charts limits = props.getCharts();
            result = executor.query(sql, limits.getMaxRows(), limits.getQueryTimeoutSeconds());
        } catch (DataAccessException e) {
            String msg = Objects.toString(e.getMostSpecificCause().getMessage(), e.getClass().getSimpleName());
            log.error("SQL execution error for '{}': {}", title, msg);
            return ChartResult.error(title, msg.length() <= MAX_SQL_ERROR_LENGTH ? msg : msg.substring(0, MAX_SQL_ERROR_LENGTH));
        }

        if (result.isEmpty()) {
            return ChartResult.error(title, "Query returned no data");
        }
        if (result.columns().size() < 2) {
            return ChartResult.error(title, "Query returned only " + result.columns().size() + " column(s), need 2");
        }

        String xKey = result.columns().get(0);
        String yKey = result.columns().get(1);
        if (xKey.equals(yKey)) {
            return ChartResult.error(title, "Query returned two columns named '" + xKey + "'; columns need distinct names");
        }
        List<Map<String, Object>> data = new ArrayList<>(result.rows().size());
        for (Map<String, Object> row : result.rows()) {
            Double y = ResultSanitizer.toDouble(row.get(yKey));
            if (y == null) continue;
            Map<String, Object> clean = ResultSanitizer.cleanRow(row);
            clean.put(yKey, y);
            data.add(clean);
        }
        return ChartResult.ok(title, ChartType.normalize(spec.chartType()), xKey, yKey, data);
    }

    private static ChartSpec toSpec(JsonNode node) {
        String title = node.path("title").asText("Chart");
        if (title.isBlank()) title = "Chart";
        String type = node.path("chart_type").asText("bar").trim().toLowerCase(Locale.ROOT);
        if (type.isEmpty()) type = "bar";
        String sql = node.path("sql").isTextual() ? node.path("sql").asText().trim() : "";
        return new ChartSpec(title, type, sql);
    }

    /**
     * Numbered last lines of the chart trace, behind a caution banner.
     */
    static String digest(String questionsText) {
        List<String> lines = Arrays.stream(questionsText.split("\n"))
                .map(String::trim)
                .filter(l -> !l.isEmpty() && l.contains("("))
                .collect(Collectors.toList());
        List<String> last = lines.subList(Math.max(0, lines.size() - DIGEST_LINES), lines.size());

        StringBuilder sb = new StringBuilder(DIGEST_DISCLAIMER);
        for (int i = 0; i < last.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(i + 1).append(". ").append(last.get(i));
        }
        return sb.toString();
    }

    static String specPrompt(DatasetSchema ds, int maxCharts) {
        return """
                You are a data analyst and PostgreSQL expert.

                %s
                Given a business question, respond with ONLY a JSON array (no markdown, no explanation) of up to %d chart objects.
                Each object must have exactly these keys:
                - "title": short chart title string
                - "chart_type": one of: line, bar, pie
                - "sql": a valid PostgreSQL SELECT query against the table called %s

                SQL rules:
                - Always double-quote column names.
                - Select exactly 2 columns: first is the x-axis label or group, second is the numeric y value.
                - Always use GROUP BY with an aggregation (SUM, AVG, COUNT).
                - For dates use: TO_CHAR(%s, 'YYYY-MM') AS month
                - LIMIT results to 15 rows max.
                - Do NOT use aliases that shadow column names.
                - The table name is %s (no quotes around the table name).
                """.formatted(SchemaDescriber.describe(ds), maxCharts, ds.getTable(),
                ds.quoted(DatasetSchema.TRANSACTION_DATE), ds.getTable());
    }

    public record Visualization(List<ChartResult> charts, String questionsText) {}
}
