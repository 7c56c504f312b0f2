package org.iceforge.saga.analytics.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single wide table the service queries, with its columns keyed by role.
 */
public class DatasetSchema {

    public static final String TRANSACTION_DATE = "transactionDate";
    public static final String REVENUE = "revenue";
    public static final String LOST_REVENUE = "lostRevenue";
    public static final String CAC = "cac";
    public static final String CAC_PERCENT = "cacPercent";
    public static final String AOV = "aov";
    public static final String LTV = "ltv";
    public static final String ROAS = "roas";
    public static final String CATEGORY = "category";
    public static final String REGION = "region";
    public static final String CUSTOMER_TENURE = "customerTenure";
    public static final String CUSTOMER_RECENCY = "customerRecency";
    public static final String TOTAL_TRANSACTIONS = "totalTransactions";
    public static final String DAYS_SINCE_FIRST_PURCHASE = "daysSinceFirstPurchase";
    public static final String DISCOUNT = "discount";
    public static final String CUSTOMER_LIFETIME = "customerLifetime";

    private String table;
    private String description;
    private Map<String, String> columns = new LinkedHashMap<>(); // role -> physical column

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Map<String, String> getColumns() {
        return columns;
    }

    public void setColumns(Map<String, String> columns) {
        this.columns = columns;
    }

    /**
     * Physical column for a role, double-quoted for interpolation into SQL.
     */
    public String quoted(String role) {
        String col = columns == null ? null : columns.get(role);
        if (col == null) {
            throw new IllegalStateException("Dataset schema has no column for role '" + role + "'");
        }
        return quoteIdentifier(col);
    }

    public static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }
}
