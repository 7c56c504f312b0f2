package org.iceforge.saga.analytics.service;

import org.iceforge.saga.analytics.TestWarehouse;
import org.iceforge.saga.analytics.config.SagaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SqlChainQuestionAnswererTest {

    private ScriptedTextGenerator generator;
    private SqlChainQuestionAnswerer answerer;

    @BeforeEach
    void setUp() {
        JdbcTemplate jdbc = TestWarehouse.seeded("answerer");
        generator = new ScriptedTextGenerator();
        answerer = new SqlChainQuestionAnswerer(generator, new ReadOnlyQueryGuard(),
                new WarehouseQueryExecutor(jdbc), TestWarehouse.schemaLoader(), new SagaProperties());
    }

    @Test
    void runsGeneratedQueryAndPhrasesAnswer() {
        generator.reply("```sql\nSELECT \"Region\", COUNT(*) AS n FROM main GROUP BY \"Region\" ORDER BY n DESC LIMIT 1\n```",
                " North has the most transactions (5). ");

        SubAnswer a = answerer.answer("Which region has the most transactions?");

        assertThat(a.success()).isTrue();
        assertThat(a.text()).isEqualTo("North has the most transactions (5).");
        assertThat(generator.requests.get(0).get(0).content()).contains("\"Customer Days Since First Purchase\"");
        assertThat(generator.requests.get(1).get(1).content()).contains("| Region | n |").contains("| North | 5 |");
    }

    @Test
    void rejectedQueryIsReportedAsError() {
        generator.reply("DELETE FROM main");

        SubAnswer a = answerer.answer("Clean up?");

        assertThat(a.success()).isFalse();
        assertThat(a.text()).isEqualTo("Error: Only read-only queries allowed");
        assertThat(generator.requests).hasSize(1);
    }

    @Test
    void executionErrorIsTruncated() {
        generator.reply("SELECT no_such_column FROM main WHERE " + "1 = 1 AND ".repeat(100) + "1 = 1");

        SubAnswer a = answerer.answer("Broken?");

        assertThat(a.success()).isFalse();
        assertThat(a.text()).startsWith("Error: ").hasSizeLessThanOrEqualTo(200);
    }

    @Test
    void formatsMarkdownTable() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("category", "Home");
        row.put("total", 610.0);

        assertThat(SqlChainQuestionAnswerer.formatAsMarkdownTable(List.of(row)))
                .isEqualTo("| category | total | \n| --- | --- | \n| Home | 610.0 | \n");
        assertThat(SqlChainQuestionAnswerer.formatAsMarkdownTable(List.of())).isEqualTo("(no rows)");
    }
}
