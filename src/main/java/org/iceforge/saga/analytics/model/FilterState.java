package org.iceforge.saga.analytics.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Pattern;

import java.math.BigDecimal;
import java.util.List;

/**
 * Dashboard filter selections. Every field is optional; an absent or empty constraint
 * does not restrict the dataset. A min greater than its max is passed through as-is.
 */
public class FilterState {

    private List<String> regions;
    private List<String> categories;
    private List<String> customerTenure;
    private List<String> customerRecency;

    @PositiveOrZero
    private Integer totalTransactionsMin;

    @PositiveOrZero
    private Integer totalTransactionsMax;

    @DecimalMin("0")
    private BigDecimal discountMin;

    @DecimalMin("0")
    private BigDecimal discountMax;

    /**
     * all | 1m | 3m | 6m | 1y
     */
    @Pattern(regexp = "all|1m|3m|6m|1y", message = "timeFilter must be one of all, 1m, 3m, 6m, 1y")
    private String timeFilter = TimeWindow.ALL.code();

    public static FilterState none() {
        return new FilterState();
    }

    public List<String> getRegions() {
        return regions;
    }

    public void setRegions(List<String> regions) {
        this.regions = regions;
    }

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public List<String> getCustomerTenure() {
        return customerTenure;
    }

    public void setCustomerTenure(List<String> customerTenure) {
        this.customerTenure = customerTenure;
    }

    public List<String> getCustomerRecency() {
        return customerRecency;
    }

    public void setCustomerRecency(List<String> customerRecency) {
        this.customerRecency = customerRecency;
    }

    public Integer getTotalTransactionsMin() {
        return totalTransactionsMin;
    }

    public void setTotalTransactionsMin(Integer totalTransactionsMin) {
        this.totalTransactionsMin = totalTransactionsMin;
    }

    public Integer getTotalTransactionsMax() {
        return totalTransactionsMax;
    }

    public void setTotalTransactionsMax(Integer totalTransactionsMax) {
        this.totalTransactionsMax = totalTransactionsMax;
    }

    public BigDecimal getDiscountMin() {
        return discountMin;
    }

    public void setDiscountMin(BigDecimal discountMin) {
        this.discountMin = discountMin;
    }

    public BigDecimal getDiscountMax() {
        return discountMax;
    }

    public void setDiscountMax(BigDecimal discountMax) {
        this.discountMax = discountMax;
    }

    public String getTimeFilter() {
        return timeFilter;
    }

    public void setTimeFilter(String timeFilter) {
        this.timeFilter = timeFilter;
    }
}
