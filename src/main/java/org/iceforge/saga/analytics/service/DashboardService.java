package org.iceforge.saga.analytics.service;

import org.iceforge.saga.analytics.model.DashboardBundle;
import org.iceforge.saga.analytics.model.DashboardBundle.*;
import org.iceforge.saga.analytics.model.DatasetSchema;
import org.iceforge.saga.analytics.model.FilterState;
import org.iceforge.saga.analytics.model.PredicateFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Builds the dashboard from a fixed battery of aggregate queries. Any failing query fails the
 * whole bundle; partial dashboards are never returned.
 */
@Service
public class DashboardService {

    private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

    static final List<String> REGION_PALETTE = List.of(
            "#3b82f6", "#f97316", "#10b981", "#ec4899", "#f59e0b", "#8b5cf6", "#06b6d4", "#ef4444");

    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);
    private static final double DEFAULT_TRANSACTIONS_MAX = 50;
    private static final double DEFAULT_DISCOUNT_MAX = 1.0;

    private final WarehouseQueryExecutor executor;
    private final PredicateCompiler compiler;
    private final DatasetSchemaLoader schemaLoader;

    public DashboardService(WarehouseQueryExecutor executor,
                            PredicateCompiler compiler,
                            DatasetSchemaLoader schemaLoader) {
        this.executor = Objects.requireNonNull(executor);
        this.compiler = Objects.requireNonNull(compiler);
        this.schemaLoader = Objects.requireNonNull(schemaLoader);
    }

    public DashboardBundle build(FilterState filters) {
        DatasetSchema ds = schemaLoader.load();
        PredicateFragment where = compiler.compile(filters);
        log.info("Building dashboard, predicate: {}", abbreviate(where.sql(), 200));

        try {
            DashboardBundle bundle = new DashboardBundle(
                    kpis(ds, where),
                    monthly(ds, where),
                    regions(ds, where),
                    categoryMonthly(ds, where),
                    histogram(ds, where),
                    aovByWeeks(ds, where),
                    roasByCategory(ds, where),
                    filterLists(ds));
            log.info("Dashboard ready: {} months, {} regions", bundle.monthlyData().size(), bundle.regionData().size());
            return bundle;
        } catch (DataAccessException e) {
            log.error("Dashboard aggregation failed", e);
            throw new QueryExecutionException("Dashboard aggregation failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private Kpis kpis(DatasetSchema ds, PredicateFragment where) {
        String sql = """
                SELECT SUM(%s) AS total_revenue,
                       AVG(%s) AS avg_aov,
                       AVG(%s) AS avg_ltv,
                       AVG(%s) AS avg_cac_percent,
                       AVG(%s) AS avg_roas,
                       AVG(%s) AS avg_lifetime
                FROM %s
                %s
                """.formatted(
                ds.quoted(DatasetSchema.REVENUE), ds.quoted(DatasetSchema.AOV), ds.quoted(DatasetSchema.LTV),
                ds.quoted(DatasetSchema.CAC_PERCENT), ds.quoted(DatasetSchema.ROAS),
                ds.quoted(DatasetSchema.CUSTOMER_LIFETIME), ds.getTable(), where.sql());

        List<Object> r = new ArrayList<>(executor.query(sql).firstRow().values());
        return new Kpis(
                orZero(valueAt(r, 0)), orZero(valueAt(r, 1)), orZero(valueAt(r, 2)),
                orZero(valueAt(r, 3)), orZero(valueAt(r, 4)), orZero(valueAt(r, 5)));
    }

    private List<MonthlyPoint> monthly(DatasetSchema ds, PredicateFragment where) {
        String month = monthExpr(ds);
        String sql = """
                SELECT %s AS txn_month,
                       SUM(%s) AS revenue,
                       SUM(%s) AS lost_revenue,
                       AVG(%s) AS cac
                FROM %s
                %s
                GROUP BY %s
                ORDER BY txn_month ASC
                """.formatted(month, ds.quoted(DatasetSchema.REVENUE), ds.quoted(DatasetSchema.LOST_REVENUE),
                ds.quoted(DatasetSchema.CAC), ds.getTable(), where.sql(), month);

        List<MonthlyPoint> out = new ArrayList<>();
        for (Map<String, Object> row : executor.query(sql).rows()) {
            List<Object> r = new ArrayList<>(row.values());
            out.add(new MonthlyPoint(
                    monthLabel(valueAt(r, 0)),
                    ResultSanitizer.toDouble(valueAt(r, 1)),
                    ResultSanitizer.toDouble(valueAt(r, 2)),
                    ResultSanitizer.toDouble(valueAt(r, 3))));
        }
        return out;
    }

    private List<RegionSlice> regions(DatasetSchema ds, PredicateFragment where) {
        String region = ds.quoted(DatasetSchema.REGION);
        String sql = """
                SELECT %s AS region,
                       COUNT(*) AS region_count
                FROM %s
                %s
                GROUP BY %s
                ORDER BY region_count DESC
                """.formatted(region, ds.getTable(), where.sql(), region);

        List<RegionSlice> out = new ArrayList<>();
        int rank = 0;
        for (Map<String, Object> row : executor.query(sql).rows()) {
            List<Object> r = new ArrayList<>(row.values());
            Object name = ResultSanitizer.clean(valueAt(r, 0));
            out.add(new RegionSlice(
                    name == null ? null : name.toString(),
                    ResultSanitizer.toLong(valueAt(r, 1)),
                    REGION_PALETTE.get(rank++ % REGION_PALETTE.size())));
        }
        return out;
    }

    private List<Map<String, Object>> categoryMonthly(DatasetSchema ds, PredicateFragment where) {
        String month = monthExpr(ds);
        String category = ds.quoted(DatasetSchema.CATEGORY);
        String sql = """
                SELECT %s AS txn_month,
                       %s AS category,
                       COUNT(*) AS volume
                FROM %s
                %s
                GROUP BY %s, %s
                ORDER BY txn_month ASC, category ASC
                """.formatted(month, category, ds.getTable(), where.sql(), month, category);

        // month key -> category -> volume, months in query (chronological) order
        Map<String, Map<String, Long>> byMonth = new LinkedHashMap<>();
        SortedSet<String> categories = new TreeSet<>();
        for (Map<String, Object> row : executor.query(sql).rows()) {
            List<Object> r = new ArrayList<>(row.values());
            Object m = ResultSanitizer.clean(valueAt(r, 0));
            Object c = ResultSanitizer.clean(valueAt(r, 1));
            if (m == null || c == null) continue;
            Long volume = ResultSanitizer.toLong(valueAt(r, 2));
            categories.add(c.toString());
            byMonth.computeIfAbsent(m.toString(), k -> new HashMap<>())
                    .merge(c.toString(), volume == null ? 0L : volume, Long::sum);
        }

        List<Map<String, Object>> pivot = new ArrayList<>(byMonth.size());
        byMonth.forEach((monthKey, volumes) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("month", monthLabel(monthKey));
            for (String c : categories) {
                row.put(c, volumes.getOrDefault(c, 0L));
            }
            pivot.add(row);
        });
        return pivot;
    }

    private List<HistogramBin> histogram(DatasetSchema ds, PredicateFragment where) {
        String txns = ds.quoted(DatasetSchema.TOTAL_TRANSACTIONS);
        String sql = """
                SELECT %s AS num_purchases,
                       COUNT(*) AS customer_count
                FROM %s
                %s
                GROUP BY %s
                ORDER BY num_purchases ASC
                """.formatted(txns, ds.getTable(), where.sql(), txns);

        List<HistogramBin> out = new ArrayList<>();
        for (Map<String, Object> row : executor.query(sql).rows()) {
            List<Object> r = new ArrayList<>(row.values());
            out.add(new HistogramBin(ResultSanitizer.toLong(valueAt(r, 0)), ResultSanitizer.toLong(valueAt(r, 1))));
        }
        return out;
    }

    private List<AovBin> aovByWeeks(DatasetSchema ds, PredicateFragment where) {
        String days = ds.quoted(DatasetSchema.DAYS_SINCE_FIRST_PURCHASE);
        String aov = ds.quoted(DatasetSchema.AOV);
        String weeks = "FLOOR(" + days + " / 7.0)";
        PredicateFragment scoped = where.and(days + " IS NOT NULL", aov + " IS NOT NULL", days + " >= 0");
        String sql = """
                SELECT %s AS weeks_since_first,
                       AVG(%s) AS avg_aov
                FROM %s
                %s
                GROUP BY %s
                ORDER BY weeks_since_first ASC
                """.formatted(weeks, aov, ds.getTable(), scoped.sql(), weeks);

        List<AovBin> out = new ArrayList<>();
        for (Map<String, Object> row : executor.query(sql).rows()) {
            List<Object> r = new ArrayList<>(row.values());
            out.add(new AovBin(ResultSanitizer.toLong(valueAt(r, 0)), ResultSanitizer.toDouble(valueAt(r, 1))));
        }
        return out;
    }

    private List<CategoryRoas> roasByCategory(DatasetSchema ds, PredicateFragment where) {
        String category = ds.quoted(DatasetSchema.CATEGORY);
        String sql = """
                SELECT %s AS category,
                       AVG(%s) AS avg_roas
                FROM %s
                %s
                GROUP BY %s
                ORDER BY avg_roas DESC
                """.formatted(category, ds.quoted(DatasetSchema.ROAS), ds.getTable(), where.sql(), category);

        List<CategoryRoas> out = new ArrayList<>();
        for (Map<String, Object> row : executor.query(sql).rows()) {
            List<Object> r = new ArrayList<>(row.values());
            Object c = ResultSanitizer.clean(valueAt(r, 0));
            out.add(new CategoryRoas(c == null ? null : c.toString(), ResultSanitizer.toDouble(valueAt(r, 1))));
        }
        return out;
    }

    /**
     * Choices for the filter panel. Deliberately ignores the request's predicate.
     */
    private FilterLists filterLists(DatasetSchema ds) {
        String table = ds.getTable();
        Double txMax = ResultSanitizer.toDouble(scalar(
                "SELECT MAX(" + ds.quoted(DatasetSchema.TOTAL_TRANSACTIONS) + ") AS max_value FROM " + table));
        Double discountMax = ResultSanitizer.toDouble(scalar(
                "SELECT MAX(" + ds.quoted(DatasetSchema.DISCOUNT) + ") AS max_value FROM " + table));

        return new FilterLists(
                distinct(table, ds.quoted(DatasetSchema.REGION)),
                distinct(table, ds.quoted(DatasetSchema.CATEGORY)),
                distinct(table, ds.quoted(DatasetSchema.CUSTOMER_TENURE)),
                distinct(table, ds.quoted(DatasetSchema.CUSTOMER_RECENCY)),
                txMax == null || txMax == 0 ? DEFAULT_TRANSACTIONS_MAX : txMax,
                discountMax == null || discountMax == 0 ? DEFAULT_DISCOUNT_MAX
                        : BigDecimal.valueOf(discountMax).setScale(2, RoundingMode.HALF_UP).doubleValue());
    }

    private List<String> distinct(String table, String quotedColumn) {
        List<String> out = new ArrayList<>();
        for (String v : executor.distinctValues(table, quotedColumn)) {
            if (ResultSanitizer.clean(v) != null) out.add(v);
        }
        return out;
    }

    private Object scalar(String sql) {
        return valueAt(new ArrayList<>(executor.query(sql).firstRow().values()), 0);
    }

    private static String monthExpr(DatasetSchema ds) {
        return "TO_CHAR(" + ds.quoted(DatasetSchema.TRANSACTION_DATE) + ", 'YYYY-MM')";
    }

    static String monthLabel(Object yearMonth) {
        if (yearMonth == null) return null;
        String s = yearMonth.toString().trim();
        try {
            return YearMonth.parse(s).format(MONTH_LABEL);
        } catch (DateTimeParseException e) {
            return s;
        }
    }

    private static Object valueAt(List<Object> row, int index) {
        return index < row.size() ? row.get(index) : null;
    }

    private static double orZero(Object v) {
        Double d = ResultSanitizer.toDouble(v);
        return d == null ? 0 : d;
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
