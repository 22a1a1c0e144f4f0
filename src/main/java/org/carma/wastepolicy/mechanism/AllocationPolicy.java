package org.carma.wastepolicy.mechanism;

import org.carma.wastepolicy.model.RegionPolicy;

import java.util.List;

/**
 * Source of quarterly allocation vectors when no controller decision is pending.
 */
@FunctionalInterface
public interface AllocationPolicy {

    /**
     * @param quarter zero-based quarter index
     * @param regions regions in ledger order
     * @return vector of 3 × regions.size() budget fractions
     */
    double[] allocate(int quarter, List<RegionPolicy> regions);
}
