package org.iceforge.saga.analytics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.saga.analytics.config.SagaProperties;
import org.iceforge.saga.analytics.model.ChatExchange;
import org.iceforge.saga.analytics.model.SubQuestionPlan;
import org.iceforge.saga.analytics.model.SubQuestionResult;
import org.iceforge.saga.analytics.model.SubQuestionTrace;
import org.iceforge.saga.analytics.service.llm.ChatMessage;
import org.iceforge.saga.analytics.service.llm.GenerationOptions;
import org.iceforge.saga.analytics.service.llm.TextGenerator;
import org.iceforge.saga.analytics.service.memory.ConversationMemoryStore;
import org.iceforge.saga.analytics.service.memory.LogTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Answers a free-text question by splitting it into focused sub-questions, answering each
 * through the {@link QuestionAnswerer}, and summarising the answers in the context of the
 * recent conversation.
 */
@Service
public class DecompositionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DecompositionOrchestrator.class);

    static final int MAX_STORED_RESULT_LENGTH = 2000;

    private static final GenerationOptions PLAN_OPTIONS = GenerationOptions.of(0.7, 1000);
    private static final GenerationOptions SUMMARY_OPTIONS = GenerationOptions.of(0.7, 500);

    private static final String PLAN_PROMPT = """
            You are a data analyst working with a single transactions table (revenue, lost revenue,
            CAC, AOV, LTV, ROAS, category, region, customer tenure and recency, discounts, dates).
            Break the user's question into 5 to 8 specific questions that can each be answered with
            one SQL query against that table. Use the conversation so far for context.
            Respond with JSON only, in the form {"questions": ["...", "..."]}.
            """;

    private static final String SUMMARY_PROMPT = """
            You are a friendly business analyst. Using the findings provided, answer the user's
            question in 2 to 4 conversational sentences. Mention concrete numbers where they help.
            Do not mention SQL, queries, tables, columns or any other technical details.
            """;

    private final ConversationMemoryStore memory;
    private final TextGenerator generator;
    private final QuestionAnswerer answerer;
    private final SubQuestionParser parser;
    private final ObjectMapper objectMapper;
    private final SagaProperties props;

    public DecompositionOrchestrator(ConversationMemoryStore memory,
                                     TextGenerator generator,
                                     QuestionAnswerer answerer,
                                     SubQuestionParser parser,
                                     ObjectMapper objectMapper,
                                     SagaProperties props) {
        this.memory = Objects.requireNonNull(memory);
        this.generator = Objects.requireNonNull(generator);
        this.answerer = Objects.requireNonNull(answerer);
        this.parser = Objects.requireNonNull(parser);
        this.objectMapper = Objects.requireNonNull(objectMapper);
        this.props = Objects.requireNonNull(props);
    }

    public Analysis analyze(String question) {
        if (question == null || question.isBlank()) {
            throw new AnalyticsValidationException("user_message must not be blank");
        }
        String q = question.trim();

        List<ChatMessage> context = historyMessages(memory.recent(LogTable.CHAT, props.getHistoryWindow()));

        List<ChatMessage> planRequest = new ArrayList<>();
        planRequest.add(ChatMessage.system(PLAN_PROMPT));
        planRequest.addAll(context);
        planRequest.add(ChatMessage.user(q));
        SubQuestionPlan plan = parser.parse(generator.complete(planRequest, PLAN_OPTIONS));
        if (plan.questions().size() > props.getMaxSubQuestions()) {
            log.warn("Model proposed {} sub-questions; keeping the first {}", plan.questions().size(), props.getMaxSubQuestions());
            plan = plan.limit(props.getMaxSubQuestions());
        }
        log.info("Sub-question plan ({}): {} questions", plan.source(), plan.questions().size());

        List<SubQuestionResult> results = new ArrayList<>(plan.questions().size());
        int n = 0;
        for (String sub : plan.questions()) {
            n++;
            SubAnswer answer = answerSafely(sub);
            results.add(new SubQuestionResult(n, sub, answer.text(),
                    answer.success() ? SubQuestionResult.SUCCESS : SubQuestionResult.ERROR));
            memory.append(LogTable.SUB_QUESTIONS,
                    new SubQuestionTrace(q, sub, truncate(answer.text(), MAX_STORED_RESULT_LENGTH), answer.success(), null));
        }

        List<ChatMessage> summaryRequest = new ArrayList<>();
        summaryRequest.add(ChatMessage.system(SUMMARY_PROMPT));
        summaryRequest.addAll(context);
        summaryRequest.add(ChatMessage.user("Question: " + q + "\n\nFindings:\n" + toJson(results)));
        String summary = generator.complete(summaryRequest, SUMMARY_OPTIONS).trim();

        memory.append(LogTable.CHAT, ChatExchange.of(q, summary));
        long ok = results.stream().filter(SubQuestionResult::isSuccess).count();
        log.info("Analysis complete: {}/{} sub-questions answered", ok, results.size());
        return new Analysis(summary, plan.questions(), results);
    }

    private SubAnswer answerSafely(String question) {
        try {
            SubAnswer a = answerer.answer(question);
            return a != null ? a : SubAnswer.error("Error: no answer");
        } catch (RuntimeException e) {
            log.warn("Answerer threw for sub-question '{}'", question, e);
            return SubAnswer.error(SqlChainQuestionAnswerer.errorText(e));
        }
    }

    static List<ChatMessage> historyMessages(List<ChatExchange> history) {
        List<ChatMessage> out = new ArrayList<>(history.size() * 2);
        for (ChatExchange ex : history) {
            out.add(ChatMessage.user(ex.userMessage()));
            out.add(ChatMessage.assistant(ex.assistantResponse()));
        }
        return out;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise sub-question results", e);
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }

    public record Analysis(String summary, List<String> questions, List<SubQuestionResult> results) {}
}
