package com.wickscan.execution.dca;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Margin plan of an averaging position: {@code total} split across {@code levels} steps growing
 * geometrically by {@code growth}. Step i gets {@code total * g^i * (g - 1) / (g^N - 1)}, so the
 * steps always sum to {@code total}.
 */
public record DcaPlan(double total, double growth, List<Double> stepMargins) {

    public DcaPlan {
        stepMargins = Collections.unmodifiableList(new ArrayList<>(stepMargins));
    }

    /**
     * @param bank account bank in USDT
     * @param cumDepositFrac fraction of the bank committed once every step is filled
     */
    public static DcaPlan of(double bank, double cumDepositFrac, int levels, double growth) {
        if (levels < 1) {
            throw new IllegalArgumentException("levels must be >= 1: " + levels);
        }
        if (!(growth >= 1.0)) {
            throw new IllegalArgumentException("growth must be >= 1: " + growth);
        }
        if (!(bank > 0) || !(cumDepositFrac > 0)) {
            throw new IllegalArgumentException("bank and deposit fraction must be positive");
        }
        double total = bank * cumDepositFrac;
        List<Double> margins = new ArrayList<>(levels);
        if (growth == 1.0) {
            for (int i = 0; i < levels; i++) {
                margins.add(total / levels);
            }
        } else {
            double denominator = Math.pow(growth, levels) - 1;
            for (int i = 0; i < levels; i++) {
                margins.add(total * Math.pow(growth, i) * (growth - 1) / denominator);
            }
        }
        return new DcaPlan(total, growth, margins);
    }

    public int levels() {
        return stepMargins.size();
    }

    public double first() {
        return stepMargins.get(0);
    }

    public double last() {
        return stepMargins.get(stepMargins.size() - 1);
    }

    public double sum() {
        return stepMargins.stream().mapToDouble(Double::doubleValue).sum();
    }
}
