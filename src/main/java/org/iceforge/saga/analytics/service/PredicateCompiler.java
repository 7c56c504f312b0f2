package org.iceforge.saga.analytics.service;

import org.iceforge.saga.analytics.config.SagaProperties;
import org.iceforge.saga.analytics.model.DatasetSchema;
import org.iceforge.saga.analytics.model.FilterState;
import org.iceforge.saga.analytics.model.PredicateFragment;
import org.iceforge.saga.analytics.model.TimeWindow;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Compiles dashboard filter selections into a WHERE fragment over the transactions table.
 * Membership values are the only user-supplied strings and are escaped; everything else is
 * typed (integers, decimals, the time-window enum, the configured reference date).
 */
@Service
public class PredicateCompiler {

    private final DatasetSchemaLoader schemaLoader;
    private final LocalDate referenceDate;

    public PredicateCompiler(DatasetSchemaLoader schemaLoader, SagaProperties props) {
        this.schemaLoader = Objects.requireNonNull(schemaLoader);
        this.referenceDate = Objects.requireNonNull(props.getReferenceDate());
    }

    public PredicateFragment compile(FilterState filters) {
        if (filters == null) return PredicateFragment.empty();
        DatasetSchema ds = schemaLoader.load();

        List<String> where = new ArrayList<>();
        membership(ds.quoted(DatasetSchema.REGION), filters.getRegions()).ifPresent(where::add);
        membership(ds.quoted(DatasetSchema.CATEGORY), filters.getCategories()).ifPresent(where::add);
        membership(ds.quoted(DatasetSchema.CUSTOMER_TENURE), filters.getCustomerTenure()).ifPresent(where::add);
        membership(ds.quoted(DatasetSchema.CUSTOMER_RECENCY), filters.getCustomerRecency()).ifPresent(where::add);

        // zero minimum = no lower bound
        String txns = ds.quoted(DatasetSchema.TOTAL_TRANSACTIONS);
        Integer txMin = filters.getTotalTransactionsMin();
        if (txMin != null && txMin > 0) {
            where.add(txns + " >= " + txMin);
        }
        if (filters.getTotalTransactionsMax() != null) {
            where.add(txns + " <= " + filters.getTotalTransactionsMax());
        }

        String discount = ds.quoted(DatasetSchema.DISCOUNT);
        BigDecimal dMin = filters.getDiscountMin();
        if (dMin != null && dMin.signum() > 0) {
            where.add(discount + " >= " + dMin.toPlainString());
        }
        if (filters.getDiscountMax() != null) {
            where.add(discount + " <= " + filters.getDiscountMax().toPlainString());
        }

        TimeWindow window = TimeWindow.fromCode(filters.getTimeFilter());
        if (window != TimeWindow.ALL) {
            where.add("CAST(" + ds.quoted(DatasetSchema.TRANSACTION_DATE) + " AS TIMESTAMP) >= TIMESTAMP '"
                    + referenceDate + "' - INTERVAL '" + window.interval() + "'");
        }

        return new PredicateFragment(where);
    }

    private static Optional<String> membership(String column, Collection<String> values) {
        if (values == null || values.isEmpty()) return Optional.empty();

        Set<String> distinct = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) distinct.add(v.trim());
        }
        if (distinct.isEmpty()) return Optional.empty();

        String in = distinct.stream()
                .map(v -> "'" + escapeSqlLiteral(v) + "'")
                .collect(Collectors.joining(", "));
        return Optional.of(column + " IN (" + in + ")");
    }

    static String escapeSqlLiteral(String s) {
        return s.replace("'", "''");
    }
}
