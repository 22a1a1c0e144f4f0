package org.carma.wastepolicy.mechanism;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a controller allocation vector into per-region funds.
 *
 * The vector holds three non-negative entries per region, in the order
 * [education, enforcement, incentive], each read as a fraction of the
 * quarterly budget. If the fractions sum to more than 1 they are scaled down
 * proportionally so the total equals the budget; an all-zero vector yields no
 * spending and a scale factor of 0.0.
 */
public class AllocationScaler {

    public static final int LEVERS_PER_REGION = 3;

    /**
     * Scale an allocation vector.
     *
     * @param action controller vector of length 3 × regionCount
     * @param regionCount number of regions
     * @param quarterlyBudget spending cap for the quarter
     * @throws IllegalArgumentException on a wrong length or a negative / non-finite entry
     */
    public ScaledAllocation scale(double[] action, int regionCount, double quarterlyBudget) {
        if (action == null) {
            throw new IllegalArgumentException("Allocation vector cannot be null");
        }
        if (action.length != regionCount * LEVERS_PER_REGION) {
            throw new IllegalArgumentException(
                "Allocation vector must have " + (regionCount * LEVERS_PER_REGION)
                    + " entries, got " + action.length);
        }
        if (!(quarterlyBudget >= 0.0) || Double.isInfinite(quarterlyBudget)) {
            throw new IllegalArgumentException("Quarterly budget must be >= 0, got " + quarterlyBudget);
        }

        double sum = 0.0;
        for (int i = 0; i < action.length; i++) {
            double v = action[i];
            if (!(v >= 0.0) || Double.isInfinite(v)) {
                throw new IllegalArgumentException(
                    "Allocation entry " + i + " must be a finite value >= 0, got " + v);
            }
            sum += v;
        }

        double scaleFactor = scaleFactor(sum);
        double perUnit = scaleFactor * quarterlyBudget;

        List<FundAllocation> funds = new ArrayList<>(regionCount);
        for (int r = 0; r < regionCount; r++) {
            int base = r * LEVERS_PER_REGION;
            funds.add(new FundAllocation(
                action[base] * perUnit,
                action[base + 1] * perUnit,
                action[base + 2] * perUnit));
        }
        return new ScaledAllocation(funds, scaleFactor, quarterlyBudget);
    }

    /**
     * Factor applied to the requested fractions: 1 when within budget,
     * 1/sum when over, 0.0 when nothing is requested.
     */
    public static double scaleFactor(double requestedFractionSum) {
        if (requestedFractionSum <= 0.0) return 0.0;
        return requestedFractionSum > 1.0 ? 1.0 / requestedFractionSum : 1.0;
    }
}
