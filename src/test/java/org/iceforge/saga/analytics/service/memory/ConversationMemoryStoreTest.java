package org.iceforge.saga.analytics.service.memory;

import org.iceforge.saga.analytics.TestWarehouse;
import org.iceforge.saga.analytics.model.ChatExchange;
import org.iceforge.saga.analytics.model.SubQuestionTrace;
import org.iceforge.saga.analytics.model.VisualizationDigest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ConversationMemoryStoreTest {

    private JdbcTemplate jdbc;
    private ConversationMemoryStore store;

    @BeforeEach
    void setUp() {
        jdbc = TestWarehouse.seeded("memory-store");
        for (LogTable<?> t : LogTable.ALL) {
            jdbc.execute("DROP TABLE IF EXISTS " + t.name());
        }
        store = new ConversationMemoryStore(jdbc, LogWriteChannel.direct());
        store.ensureTables();
    }

    @Test
    void recentReturnsNewestEntriesOldestFirst() {
        for (int i = 1; i <= 7; i++) {
            store.append(LogTable.CHAT, ChatExchange.of("q" + i, "a" + i));
        }

        List<ChatExchange> recent = store.recent(LogTable.CHAT, 5);

        assertThat(recent).extracting(ChatExchange::userMessage).containsExactly("q3", "q4", "q5", "q6", "q7");
        assertThat(recent).extracting(ChatExchange::assistantResponse).containsExactly("a3", "a4", "a5", "a6", "a7");
        assertThat(recent).allSatisfy(e -> assertThat(e.createdAt()).isNotNull());
    }

    @Test
    void ensureTablesIsIdempotent() {
        store.append(LogTable.SUB_QUESTIONS, new SubQuestionTrace("why?", "what?", "42", true, null));
        store.ensureTables();

        List<SubQuestionTrace> rows = store.recent(LogTable.SUB_QUESTIONS, 10);
        assertThat(rows).singleElement().satisfies(t -> {
            assertThat(t.overarchingQuestion()).isEqualTo("why?");
            assertThat(t.success()).isTrue();
        });
    }

    @Test
    void emptyLogAndNonPositiveLimit() {
        assertThat(store.recent(LogTable.VISUALIZATION_DIGEST, 5)).isEmpty();
        store.append(LogTable.VISUALIZATION_DIGEST, new VisualizationDigest("q", "1. x (bar)", null));
        assertThat(store.recent(LogTable.VISUALIZATION_DIGEST, 0)).isEmpty();
    }

    @Test
    void appendFailuresAreSwallowed() {
        jdbc.execute("DROP TABLE chat_history");

        store.append(LogTable.CHAT, ChatExchange.of("lost", "never stored"));

        store.ensureTables();
        assertThat(store.recent(LogTable.CHAT, 5)).isEmpty();
    }

    @Test
    void unreachableDatabaseDoesNotFailStartup() {
        JdbcTemplate broken = new JdbcTemplate(new DriverManagerDataSource("jdbc:nosuchdriver:warehouse"));
        ConversationMemoryStore offline = new ConversationMemoryStore(broken, LogWriteChannel.direct());

        assertThatCode(offline::ensureTables).doesNotThrowAnyException();
        assertThatCode(() -> offline.append(LogTable.CHAT, ChatExchange.of("q", "a"))).doesNotThrowAnyException();
    }

    @Test
    void asyncChannelPreservesOrder() throws Exception {
        LogWriteChannel channel = LogWriteChannel.async(16);
        ConversationMemoryStore async = new ConversationMemoryStore(jdbc, channel);
        for (int i = 1; i <= 3; i++) {
            async.append(LogTable.CHAT, ChatExchange.of("q" + i, "a" + i));
        }
        CountDownLatch drained = new CountDownLatch(1);
        channel.submit("marker", drained::countDown);

        assertThat(drained.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(store.recent(LogTable.CHAT, 5)).extracting(ChatExchange::userMessage)
                .containsExactly("q1", "q2", "q3");
        channel.destroy();
    }
}
