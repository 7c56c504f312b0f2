package org.iceforge.saga.analytics.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.saga.analytics.TestWarehouse;
import org.iceforge.saga.analytics.config.SagaProperties;
import org.iceforge.saga.analytics.model.ChartResult;
import org.iceforge.saga.analytics.model.ChartSpec;
import org.iceforge.saga.analytics.model.VisualizationDigest;
import org.iceforge.saga.analytics.model.VisualizationTrace;
import org.iceforge.saga.analytics.service.memory.ConversationMemoryStore;
import org.iceforge.saga.analytics.service.memory.LogTable;
import org.iceforge.saga.analytics.service.memory.LogWriteChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VisualizationOrchestratorTest {

    private JdbcTemplate jdbc;
    private ConversationMemoryStore memory;
    private ScriptedTextGenerator generator;
    private VisualizationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        jdbc = TestWarehouse.seeded("visualization");
        for (LogTable<?> t : LogTable.ALL) jdbc.execute("DROP TABLE IF EXISTS " + t.name());
        memory = new ConversationMemoryStore(jdbc, LogWriteChannel.direct());
        memory.ensureTables();
        generator = new ScriptedTextGenerator();
        orchestrator = new VisualizationOrchestrator(memory, generator, new ChartSpecParser(new ObjectMapper()),
                new ReadOnlyQueryGuard(), new WarehouseQueryExecutor(jdbc), TestWarehouse.schemaLoader(),
                new SagaProperties());
    }

    @Test
    void invalidChartDoesNotAbortSiblings() {
        generator.reply("""
                [
                  {"title": "Revenue by Region", "chart_type": "bar",
                   "sql": "SELECT \\"Region\\", SUM(\\"Revenue\\") AS total_revenue FROM main GROUP BY \\"Region\\" ORDER BY total_revenue DESC"},
                  {"title": "Monthly Revenue", "chart_type": "line",
                   "sql": "SELECT TO_CHAR(\\"Transaction_Date\\", 'YYYY-MM') AS txn_month, SUM(\\"Revenue\\") AS total FROM main GROUP BY TO_CHAR(\\"Transaction_Date\\", 'YYYY-MM') ORDER BY txn_month"},
                  {"title": "Oops", "chart_type": "bar", "sql": "DROP TABLE main"},
                  {"title": "Category Share", "chart_type": "pie",
                   "sql": "SELECT \\"Category\\", COUNT(*) AS orders FROM main GROUP BY \\"Category\\""}
                ]
                """);

        VisualizationOrchestrator.Visualization v = orchestrator.generate("Show me revenue");

        assertThat(v.charts()).hasSize(4);
        assertThat(v.charts()).filteredOn(ChartResult::failed).singleElement().satisfies(c -> {
            assertThat(c.title()).isEqualTo("Oops");
            assertThat(c.error()).isEqualTo("Only read-only queries allowed");
        });

        ChartResult regions = v.charts().get(0);
        assertThat(regions.chartType()).isEqualTo("bar");
        assertThat(regions.xKey()).isEqualTo("Region");
        assertThat(regions.yKey()).isEqualTo("total_revenue");
        assertThat(regions.data().get(0)).containsEntry("Region", "North").containsEntry("total_revenue", 1250.0);

        assertThat(v.charts().get(1).data()).hasSize(3);
        assertThat(v.charts().get(3).chartType()).isEqualTo("pie");
        assertThat(v.charts().get(3).data().get(0).get("orders")).isInstanceOf(Double.class);

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM main", Integer.class)).isEqualTo(12);
        assertThat(v.questionsText()).isEqualTo(
                "Revenue by Region (bar)\nMonthly Revenue (line)\nOops (bar)\nCategory Share (pie)");
        assertThat(generator.options.get(0).temperature()).isEqualTo(0.2);
    }

    @Test
    void persistsTraceAndDigest() {
        generator.reply("[{\"title\": \"A\", \"chart_type\": \"bar\", \"sql\": \"SELECT \\\"Region\\\", COUNT(*) AS n FROM main GROUP BY \\\"Region\\\"\"}]");

        orchestrator.generate("Regions?");

        List<VisualizationTrace> traces = memory.recent(LogTable.VISUALIZATIONS, 5);
        assertThat(traces).singleElement().satisfies(t -> {
            assertThat(t.userInputQuestion()).isEqualTo("Regions?");
            assertThat(t.queries()).isEqualTo("A (bar)");
        });
        List<VisualizationDigest> digests = memory.recent(LogTable.VISUALIZATION_DIGEST, 5);
        assertThat(digests).singleElement().satisfies(d ->
                assertThat(d.subQuestions()).startsWith("DISCLAIMER").endsWith("1. A (bar)"));
    }

    @Test
    void digestKeepsLastFiveNumberedLines() {
        String digest = VisualizationOrchestrator.digest("a (bar)\nno parens\nb (bar)\nc (pie)\nd (line)\ne (bar)\nf (bar)");

        assertThat(digest).isEqualTo(VisualizationOrchestrator.DIGEST_DISCLAIMER
                + "1. b (bar)\n2. c (pie)\n3. d (line)\n4. e (bar)\n5. f (bar)");
    }

    @Test
    void shapesFailuresPerChart() {
        assertThat(orchestrator.render(new ChartSpec("Empty", "bar", "")).error()).isEqualTo("No SQL provided");
        assertThat(orchestrator.render(new ChartSpec("None", "bar",
                "SELECT \"Region\", COUNT(*) AS n FROM main WHERE \"Region\" = 'Atlantis' GROUP BY \"Region\"")).error())
                .isEqualTo("Query returned no data");
        assertThat(orchestrator.render(new ChartSpec("One", "bar", "SELECT COUNT(*) AS n FROM main")).error())
                .isEqualTo("Query returned only 1 column(s), need 2");
        assertThat(orchestrator.render(new ChartSpec("Bad", "bar", "SELECT nope, 1 FROM main")).error())
                .isNotBlank().hasSizeLessThanOrEqualTo(300);
    }

    @Test
    void dropsRowsWhoseValueIsNotNumericAndNormalisesType() {
        ChartResult r = orchestrator.render(new ChartSpec("Tenure", "donut",
                "SELECT \"Region\", CASE WHEN \"Region\" = 'West' THEN 'n/a' ELSE '1' END AS v FROM main"));

        assertThat(r.chartType()).isEqualTo("bar");
        assertThat(r.data()).hasSize(11).noneMatch(row -> "West".equals(row.get("Region")));
    }

    @Test
    void dropsRowsWhoseValueIsNotFinite() {
        ChartResult r = orchestrator.render(new ChartSpec("Ratio", "bar",
                "SELECT \"Region\", CASE WHEN \"Region\" = 'West' THEN CAST('NaN' AS DOUBLE PRECISION)"
                        + " ELSE CAST(1 AS DOUBLE PRECISION) END AS v FROM main"));

        assertThat(r.failed()).isFalse();
        assertThat(r.data()).hasSize(11)
                .noneMatch(row -> "West".equals(row.get("Region")))
                .allSatisfy(row -> assertThat((Double) row.get("v")).isFinite());
    }

    @Test
    void chartQueriesAreCappedAtConfiguredRows() {
        SagaProperties props = new SagaProperties();
        props.getCharts().setMaxRows(50);
        VisualizationOrchestrator capped = new VisualizationOrchestrator(memory, generator,
                new ChartSpecParser(new ObjectMapper()), new ReadOnlyQueryGuard(), new WarehouseQueryExecutor(jdbc),
                TestWarehouse.schemaLoader(), props);

        ChartResult r = capped.render(new ChartSpec("Big", "bar",
                "SELECT \"X\" AS a, \"X\" AS b FROM SYSTEM_RANGE(1, 200000)"));

        assertThat(r.failed()).isFalse();
        assertThat(r.data()).hasSize(50);
    }

    @Test
    void rejectsChartWhoseColumnsShareAName() {
        ChartResult r = orchestrator.render(new ChartSpec("Clash", "bar",
                "SELECT \"Region\" AS n, COUNT(*) AS n FROM main GROUP BY \"Region\""));

        assertThat(r.failed()).isTrue();
        assertThat(r.error()).isEqualTo("Query returned two columns named 'n'; columns need distinct names");
    }

    @Test
    void nonObjectSpecsFailIndividuallyAndExtraSpecsAreIgnored() {
        generator.reply("[1, {\"title\": \"x\", \"sql\": \"\"}, {}, {}, {\"title\": \"ignored\"}]");

        VisualizationOrchestrator.Visualization v = orchestrator.generate("Charts");

        assertThat(v.charts()).hasSize(4).allMatch(ChartResult::failed);
        assertThat(v.charts().get(0).error()).isEqualTo("Chart spec is not a JSON object");
        assertThat(v.charts().get(1).error()).isEqualTo("No SQL provided");
    }

    @Test
    void unparseableResponseIsAGenerationError() {
        generator.reply("I cannot help with that.");

        assertThatThrownBy(() -> orchestrator.generate("Charts"))
                .isInstanceOf(GenerationException.class);
        assertThat(memory.recent(LogTable.VISUALIZATIONS, 5)).isEmpty();
    }
}
