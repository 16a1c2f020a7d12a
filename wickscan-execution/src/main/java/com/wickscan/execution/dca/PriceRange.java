package com.wickscan.execution.dca;

/**
 * Closed price interval {@code [lower, upper]}.
 */
public record PriceRange(double lower, double upper) {

    public PriceRange {
        if (!(upper >= lower)) {
            throw new IllegalArgumentException("upper < lower: " + lower + " / " + upper);
        }
    }

    public double width() {
        return upper - lower;
    }

    public double mid() {
        return (lower + upper) / 2;
    }

    public double widthPct() {
        return lower > 0 ? width() / lower * 100.0 : Double.NaN;
    }

    public boolean contains(double price) {
        return price >= lower && price <= upper;
    }

    @Override
    public String toString() {
        return String.format("[%.6g .. %.6g]", lower, upper);
    }
}
