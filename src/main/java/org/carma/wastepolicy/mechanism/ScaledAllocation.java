package org.carma.wastepolicy.mechanism;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of scaling a controller allocation vector to the quarterly budget.
 *
 * Contains:
 * - Per-region fund triples, in region order
 * - The scale factor applied to the requested fractions
 * - The quarterly budget the vector was scaled against
 */
public class ScaledAllocation {

    private final List<FundAllocation> regions;
    private final double scaleFactor;
    private final double quarterlyBudget;

    public ScaledAllocation(List<FundAllocation> regions, double scaleFactor, double quarterlyBudget) {
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.scaleFactor = scaleFactor;
        this.quarterlyBudget = quarterlyBudget;
    }

    public FundAllocation getRegion(int index) {
        return regions.get(index);
    }

    public List<FundAllocation> getRegions() {
        return regions;
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    public double getQuarterlyBudget() {
        return quarterlyBudget;
    }

    // ========================================================================
    // Computed Properties
    // ========================================================================

    public double getTotal() {
        return regions.stream().mapToDouble(FundAllocation::total).sum();
    }

    public double getTotalEducation() {
        return regions.stream().mapToDouble(FundAllocation::education).sum();
    }

    public double getTotalEnforcement() {
        return regions.stream().mapToDouble(FundAllocation::enforcement).sum();
    }

    public double getTotalIncentive() {
        return regions.stream().mapToDouble(FundAllocation::incentive).sum();
    }

    /**
     * Share of the quarterly budget given to a single amount, 0.0 for a zero budget.
     */
    public double shareOfBudget(double amount) {
        if (quarterlyBudget <= 0.0) return 0.0;
        return amount / quarterlyBudget;
    }

    @Override
    public String toString() {
        return String.format("ScaledAllocation[regions=%d, total=%.2f of %.2f, scale=%.4f]",
            regions.size(), getTotal(), quarterlyBudget, scaleFactor);
    }
}
