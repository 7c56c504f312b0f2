package org.iceforge.saga.analytics.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Conjunction of SQL conditions. Renders to an empty string when there are none.
 */
public record PredicateFragment(List<String> conditions) {

    public PredicateFragment {
        conditions = List.copyOf(conditions);
    }

    public static PredicateFragment empty() {
        return new PredicateFragment(List.of());
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public PredicateFragment and(String... more) {
        List<String> all = new ArrayList<>(conditions);
        all.addAll(Arrays.asList(more));
        return new PredicateFragment(all);
    }

    public String sql() {
        if (conditions.isEmpty()) return "";
        return "WHERE " + String.join(" AND ", conditions);
    }

    @Override
    public String toString() {
        return sql();
    }
}
