package org.carma.wastepolicy.mechanism;

/**
 * One region's quarterly funds.
 */
public record FundAllocation(double education, double enforcement, double incentive) {

    public static final FundAllocation ZERO = new FundAllocation(0.0, 0.0, 0.0);

    public double total() {
        return education + enforcement + incentive;
    }
}
