package org.carma.wastepolicy.model;

import java.util.Random;

/**
 * Ordinal household income tiers.
 * Lower tiers are more sensitive to money: their income weight scales the
 * monetary part of the compliance cost.
 */
public enum IncomeTier {
    LOW(1.5, 0.5),
    MID(1.2, 0.3),
    HIGH(1.0, 0.2);

    private final double incomeWeight;
    private final double populationShare;

    IncomeTier(double incomeWeight, double populationShare) {
        this.incomeWeight = incomeWeight;
        this.populationShare = populationShare;
    }

    public double getIncomeWeight() {
        return incomeWeight;
    }

    public double getPopulationShare() {
        return populationShare;
    }

    /**
     * Draw a tier according to the population shares.
     */
    public static IncomeTier sample(Random random) {
        double roll = random.nextDouble();
        double cumulative = 0.0;
        for (IncomeTier tier : values()) {
            cumulative += tier.populationShare;
            if (roll < cumulative) {
                return tier;
            }
        }
        return HIGH;
    }
}
