package org.iceforge.saga.analytics.service;

/**
 * Answers one focused data question, typically by generating and running a query.
 * Implementations report failures in the returned answer instead of throwing.
 */
public interface QuestionAnswerer {

    SubAnswer answer(String question);
}
