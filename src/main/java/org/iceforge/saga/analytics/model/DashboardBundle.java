package org.iceforge.saga.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Everything the dashboard renders for one filter state. JSON names follow the dashboard
 * client's contract.
 */
public record DashboardBundle(
        Kpis kpis,
        List<MonthlyPoint> monthlyData,
        List<RegionSlice> regionData,
        List<Map<String, Object>> categoryMonthlyData, // month + one column per category
        List<HistogramBin> histogramData,
        List<AovBin> aovDaysData,
        List<CategoryRoas> roasCategoryData,
        FilterLists filterLists
) {

    public record Kpis(
            double totalRevenue,
            @JsonProperty("avgAOV") double avgAov,
            @JsonProperty("avgLTV") double avgLtv,
            @JsonProperty("avgCACPercent") double avgCacPercent,
            @JsonProperty("avgROAS") double avgRoas,
            double avgLifetime
    ) {}

    public record MonthlyPoint(
            String month,
            Double revenue,
            @JsonProperty("lost_revenue") Double lostRevenue,
            Double cac
    ) {}

    public record RegionSlice(String name, Long value, String fill) {}

    public record HistogramBin(
            @JsonProperty("num_purchases") Long numPurchases,
            @JsonProperty("customer_count") Long customerCount
    ) {}

    public record AovBin(
            @JsonProperty("weeks_since_first") Long weeksSinceFirst,
            @JsonProperty("avg_aov") Double avgAov
    ) {}

    public record CategoryRoas(
            String category,
            @JsonProperty("avg_roas") Double avgRoas
    ) {}

    public record FilterLists(
            List<String> regions,
            List<String> categories,
            List<String> tenureList,
            List<String> recencyList,
            double transactionsMax,
            double discountMax
    ) {}
}
