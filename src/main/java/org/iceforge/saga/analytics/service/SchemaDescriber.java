package org.iceforge.saga.analytics.service;

import org.iceforge.saga.analytics.model.DatasetSchema;
import org.springframework.util.StringUtils;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Renders the dataset schema as prompt text, so generated SQL uses the same table and column
 * names the service itself queries.
 */
public final class SchemaDescriber {
    private SchemaDescriber() {}

    public static String describe(DatasetSchema ds) {
        StringBuilder sb = new StringBuilder();
        sb.append("Table: ").append(ds.getTable()).append('\n');
        if (StringUtils.hasText(ds.getDescription())) {
            sb.append(ds.getDescription().trim()).append('\n');
        }
        sb.append("Columns (always wrap in double quotes exactly as shown):\n");
        Set<String> seen = new LinkedHashSet<>(ds.getColumns().values());
        for (String col : seen) {
            sb.append("- ").append(DatasetSchema.quoteIdentifier(col)).append('\n');
        }
        return sb.toString();
    }
}
