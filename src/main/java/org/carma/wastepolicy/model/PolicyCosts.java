package org.carma.wastepolicy.model;

/**
 * Money-to-intensity conversion constants shared by all regions.
 *
 * - Education saturates per household (door-to-door campaigns), so larger
 *   regions need proportionally more money for the same intensity.
 * - Enforcement saturates per area (patrols cover ground, not people).
 * - Fines and incentives enter household utility after normalisation.
 */
public final class PolicyCosts {

    public static final PolicyCosts DEFAULT = new Builder().build();

    private final double educationCostPerHousehold;
    private final double enforcementSaturation;
    private final double unitCostPerQuarter;
    private final double fineAmount;
    private final double fineNormalization;
    private final double incentiveNormalization;

    private PolicyCosts(Builder b) {
        this.educationCostPerHousehold = b.educationCostPerHousehold;
        this.enforcementSaturation = b.enforcementSaturation;
        this.unitCostPerQuarter = b.unitCostPerQuarter;
        this.fineAmount = b.fineAmount;
        this.fineNormalization = b.fineNormalization;
        this.incentiveNormalization = b.incentiveNormalization;
    }

    public double getEducationCostPerHousehold() { return educationCostPerHousehold; }
    public double getEnforcementSaturation() { return enforcementSaturation; }
    public double getUnitCostPerQuarter() { return unitCostPerQuarter; }
    public double getFineAmount() { return fineAmount; }
    public double getFineNormalization() { return fineNormalization; }
    public double getIncentiveNormalization() { return incentiveNormalization; }

    @Override
    public String toString() {
        return String.format(
            "PolicyCosts[educationPerHousehold=%.1f, enforcementSaturation=%.1f, unitCost=%.1f, fine=%.1f]",
            educationCostPerHousehold, enforcementSaturation, unitCostPerQuarter, fineAmount);
    }

    public static class Builder {
        private double educationCostPerHousehold = 650.0;
        private double enforcementSaturation = 375_000.0;
        private double unitCostPerQuarter = 45_000.0;
        private double fineAmount = 500.0;
        private double fineNormalization = 1000.0;
        private double incentiveNormalization = 1000.0;

        public Builder() {}

        public Builder educationCostPerHousehold(double v) { this.educationCostPerHousehold = v; return this; }
        public Builder enforcementSaturation(double v) { this.enforcementSaturation = v; return this; }
        public Builder unitCostPerQuarter(double v) { this.unitCostPerQuarter = v; return this; }
        public Builder fineAmount(double v) { this.fineAmount = v; return this; }
        public Builder fineNormalization(double v) { this.fineNormalization = v; return this; }
        public Builder incentiveNormalization(double v) { this.incentiveNormalization = v; return this; }

        public PolicyCosts build() {
            requirePositive("educationCostPerHousehold", educationCostPerHousehold);
            requirePositive("enforcementSaturation", enforcementSaturation);
            requirePositive("unitCostPerQuarter", unitCostPerQuarter);
            if (!(fineAmount >= 0.0) || Double.isInfinite(fineAmount)) {
                throw new IllegalArgumentException("fineAmount must be >= 0, got " + fineAmount);
            }
            requirePositive("fineNormalization", fineNormalization);
            requirePositive("incentiveNormalization", incentiveNormalization);
            return new PolicyCosts(this);
        }

        private static void requirePositive(String name, double value) {
            if (!(value > 0.0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }
    }
}
