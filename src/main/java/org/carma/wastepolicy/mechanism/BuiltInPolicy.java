package org.carma.wastepolicy.mechanism;

import org.carma.wastepolicy.model.RegionPolicy;

import java.util.Arrays;
import java.util.List;

/**
 * Default allocation policies.
 */
public enum BuiltInPolicy implements AllocationPolicy {

    /** No spending at all. */
    NONE {
        @Override
        public double[] allocate(int quarter, List<RegionPolicy> regions) {
            return new double[regions.size() * AllocationScaler.LEVERS_PER_REGION];
        }
    },

    /** The whole budget split evenly over every lever of every region. */
    UNIFORM {
        @Override
        public double[] allocate(int quarter, List<RegionPolicy> regions) {
            int n = regions.size() * AllocationScaler.LEVERS_PER_REGION;
            double[] action = new double[n];
            if (n > 0) {
                Arrays.fill(action, 1.0 / n);
            }
            return action;
        }
    },

    /**
     * Population-weighted split spending 60% of the budget:
     * half on education, 30% on enforcement, 20% on incentives.
     */
    STATUS_QUO {
        @Override
        public double[] allocate(int quarter, List<RegionPolicy> regions) {
            double[] action = new double[regions.size() * AllocationScaler.LEVERS_PER_REGION];
            int totalPopulation = regions.stream().mapToInt(RegionPolicy::getPopulation).sum();
            for (int r = 0; r < regions.size(); r++) {
                double weight = totalPopulation > 0
                    ? (double) regions.get(r).getPopulation() / totalPopulation
                    : 1.0 / regions.size();
                double regionShare = STATUS_QUO_SPEND * weight;
                int base = r * AllocationScaler.LEVERS_PER_REGION;
                action[base] = regionShare * 0.5;
                action[base + 1] = regionShare * 0.3;
                action[base + 2] = regionShare * 0.2;
            }
            return action;
        }
    };

    private static final double STATUS_QUO_SPEND = 0.6;

    /**
     * Case-insensitive lookup.
     * @throws IllegalArgumentException for an unknown name
     */
    public static BuiltInPolicy fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown allocation policy: " + name
                + " (expected one of NONE, UNIFORM, STATUS_QUO)", e);
        }
    }
}
