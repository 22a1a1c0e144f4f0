package org.carma.wastepolicy.model;

import java.util.Objects;

/**
 * Behavioural parameters shared by the households and enforcement units of
 * a run.
 *
 * Built once at initialisation; every field has a default. Out-of-range values
 * are rejected by {@link Builder#build()}.
 *
 * Utility model (Theory of Planned Behavior plus money):
 * <pre>
 *   tpb     = wA·attitude + wN·norm + wC·control
 *   cost    = effort − incomeWeight · (incentive + fine · enforcementIntensity)
 *   utility = tpb − cost + ε,   ε ~ N(0, σ)
 *   comply  ⇔ utility &gt; threshold − relief · incentiveStrength
 * </pre>
 */
public final class BehaviorProfile {

    public static final BehaviorProfile DEFAULT = new Builder().build();

    private final double attitudeWeight;
    private final double normWeight;
    private final double controlWeight;
    private final double attitudeDecayRate;
    private final double educationBoost;
    private final double reactanceThreshold;
    private final double reactancePenalty;
    private final int normRadius;
    private final double normSmoothing;
    private final boolean asymmetricNorms;
    private final double normAmplification;
    private final double normFloor;
    private final double effortCost;
    private final double noiseStdDev;
    private final double complianceThreshold;
    private final double thresholdRelief;
    private final double fineUtilityPenalty;
    private final double fineAttitudePenalty;
    private final double redemptionProbability;
    private final TargetingMode targetingMode;
    private final int patrolRange;
    private final int catchRadius;

    private BehaviorProfile(Builder b) {
        this.attitudeWeight = b.attitudeWeight;
        this.normWeight = b.normWeight;
        this.controlWeight = b.controlWeight;
        this.attitudeDecayRate = b.attitudeDecayRate;
        this.educationBoost = b.educationBoost;
        this.reactanceThreshold = b.reactanceThreshold;
        this.reactancePenalty = b.reactancePenalty;
        this.normRadius = b.normRadius;
        this.normSmoothing = b.normSmoothing;
        this.asymmetricNorms = b.asymmetricNorms;
        this.normAmplification = b.normAmplification;
        this.normFloor = b.normFloor;
        this.effortCost = b.effortCost;
        this.noiseStdDev = b.noiseStdDev;
        this.complianceThreshold = b.complianceThreshold;
        this.thresholdRelief = b.thresholdRelief;
        this.fineUtilityPenalty = b.fineUtilityPenalty;
        this.fineAttitudePenalty = b.fineAttitudePenalty;
        this.redemptionProbability = b.redemptionProbability;
        this.targetingMode = b.targetingMode;
        this.patrolRange = b.patrolRange;
        this.catchRadius = b.catchRadius;
    }

    // ========================================================================
    // Norm shaping
    // ========================================================================

    /**
     * Map the raw compliant fraction of the neighbourhood to a norm target.
     * The asymmetric form amplifies good neighbourhoods and buffers bad ones
     * with a floor; both forms are monotonic and stay within [0, 1].
     */
    public double shapeNorm(double rawFraction) {
        if (!asymmetricNorms) {
            return rawFraction;
        }
        if (rawFraction > 0.5) {
            return Math.min(1.0, rawFraction * normAmplification);
        }
        return rawFraction * (1.0 - normFloor) + normFloor;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public double getAttitudeWeight() { return attitudeWeight; }
    public double getNormWeight() { return normWeight; }
    public double getControlWeight() { return controlWeight; }
    public double getAttitudeDecayRate() { return attitudeDecayRate; }
    public double getEducationBoost() { return educationBoost; }
    public double getReactanceThreshold() { return reactanceThreshold; }
    public double getReactancePenalty() { return reactancePenalty; }
    public int getNormRadius() { return normRadius; }
    public double getNormSmoothing() { return normSmoothing; }
    public boolean isAsymmetricNorms() { return asymmetricNorms; }
    public double getNormAmplification() { return normAmplification; }
    public double getNormFloor() { return normFloor; }
    public double getEffortCost() { return effortCost; }
    public double getNoiseStdDev() { return noiseStdDev; }
    public double getComplianceThreshold() { return complianceThreshold; }
    public double getThresholdRelief() { return thresholdRelief; }
    public double getFineUtilityPenalty() { return fineUtilityPenalty; }
    public double getFineAttitudePenalty() { return fineAttitudePenalty; }
    public double getRedemptionProbability() { return redemptionProbability; }
    public TargetingMode getTargetingMode() { return targetingMode; }
    public int getPatrolRange() { return patrolRange; }
    public int getCatchRadius() { return catchRadius; }

    public Builder toBuilder() {
        return new Builder()
            .attitudeWeight(attitudeWeight)
            .normWeight(normWeight)
            .controlWeight(controlWeight)
            .attitudeDecayRate(attitudeDecayRate)
            .educationBoost(educationBoost)
            .reactanceThreshold(reactanceThreshold)
            .reactancePenalty(reactancePenalty)
            .normRadius(normRadius)
            .normSmoothing(normSmoothing)
            .asymmetricNorms(asymmetricNorms)
            .normAmplification(normAmplification)
            .normFloor(normFloor)
            .effortCost(effortCost)
            .noiseStdDev(noiseStdDev)
            .complianceThreshold(complianceThreshold)
            .thresholdRelief(thresholdRelief)
            .fineUtilityPenalty(fineUtilityPenalty)
            .fineAttitudePenalty(fineAttitudePenalty)
            .redemptionProbability(redemptionProbability)
            .targetingMode(targetingMode)
            .patrolRange(patrolRange)
            .catchRadius(catchRadius);
    }

    @Override
    public String toString() {
        return String.format(
            "BehaviorProfile[w=(%.2f,%.2f,%.2f), decay=%.4f, threshold=%.2f, targeting=%s]",
            attitudeWeight, normWeight, controlWeight, attitudeDecayRate,
            complianceThreshold, targetingMode);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private double attitudeWeight = 0.4;
        private double normWeight = 0.3;
        private double controlWeight = 0.3;
        private double attitudeDecayRate = 0.005;
        private double educationBoost = 0.02;
        private double reactanceThreshold = 0.8;
        private double reactancePenalty = 0.002;
        private int normRadius = 2;
        private double normSmoothing = 0.3;
        private boolean asymmetricNorms = true;
        private double normAmplification = 1.2;
        private double normFloor = 0.2;
        private double effortCost = 0.15;
        private double noiseStdDev = 0.05;
        private double complianceThreshold = 0.5;
        private double thresholdRelief = 0.05;
        private double fineUtilityPenalty = 0.5;
        private double fineAttitudePenalty = 0.01;
        private double redemptionProbability = 0.05;
        private TargetingMode targetingMode = TargetingMode.NEAREST_VIOLATOR;
        private int patrolRange = 5;
        private int catchRadius = 1;

        public Builder() {}

        public Builder attitudeWeight(double v) { this.attitudeWeight = v; return this; }
        public Builder normWeight(double v) { this.normWeight = v; return this; }
        public Builder controlWeight(double v) { this.controlWeight = v; return this; }
        public Builder attitudeDecayRate(double v) { this.attitudeDecayRate = v; return this; }
        public Builder educationBoost(double v) { this.educationBoost = v; return this; }
        public Builder reactanceThreshold(double v) { this.reactanceThreshold = v; return this; }
        public Builder reactancePenalty(double v) { this.reactancePenalty = v; return this; }
        public Builder normRadius(int v) { this.normRadius = v; return this; }
        public Builder normSmoothing(double v) { this.normSmoothing = v; return this; }
        public Builder asymmetricNorms(boolean v) { this.asymmetricNorms = v; return this; }
        public Builder normAmplification(double v) { this.normAmplification = v; return this; }
        public Builder normFloor(double v) { this.normFloor = v; return this; }
        public Builder effortCost(double v) { this.effortCost = v; return this; }
        public Builder noiseStdDev(double v) { this.noiseStdDev = v; return this; }
        public Builder complianceThreshold(double v) { this.complianceThreshold = v; return this; }
        public Builder thresholdRelief(double v) { this.thresholdRelief = v; return this; }
        public Builder fineUtilityPenalty(double v) { this.fineUtilityPenalty = v; return this; }
        public Builder fineAttitudePenalty(double v) { this.fineAttitudePenalty = v; return this; }
        public Builder redemptionProbability(double v) { this.redemptionProbability = v; return this; }
        public Builder targetingMode(TargetingMode v) { this.targetingMode = v; return this; }
        public Builder patrolRange(int v) { this.patrolRange = v; return this; }
        public Builder catchRadius(int v) { this.catchRadius = v; return this; }

        /**
         * Validate and build.
         * @throws IllegalArgumentException if any parameter is out of range
         */
        public BehaviorProfile build() {
            requireNonNegative("attitudeWeight", attitudeWeight);
            requireNonNegative("normWeight", normWeight);
            requireNonNegative("controlWeight", controlWeight);
            requireUnit("attitudeDecayRate", attitudeDecayRate);
            requireUnit("educationBoost", educationBoost);
            requireUnit("reactanceThreshold", reactanceThreshold);
            requireUnit("reactancePenalty", reactancePenalty);
            if (normRadius < 1) {
                throw new IllegalArgumentException("normRadius must be >= 1, got " + normRadius);
            }
            if (!(normSmoothing > 0.0 && normSmoothing <= 1.0)) {
                throw new IllegalArgumentException(
                    "normSmoothing must be in (0, 1], got " + normSmoothing);
            }
            if (!(normAmplification >= 1.0) || Double.isInfinite(normAmplification)) {
                throw new IllegalArgumentException(
                    "normAmplification must be >= 1, got " + normAmplification);
            }
            requireUnit("normFloor", normFloor);
            requireNonNegative("effortCost", effortCost);
            requireNonNegative("noiseStdDev", noiseStdDev);
            requireUnit("complianceThreshold", complianceThreshold);
            requireUnit("thresholdRelief", thresholdRelief);
            if (thresholdRelief > complianceThreshold) {
                throw new IllegalArgumentException(
                    "thresholdRelief (" + thresholdRelief + ") cannot exceed complianceThreshold ("
                        + complianceThreshold + ")");
            }
            requireNonNegative("fineUtilityPenalty", fineUtilityPenalty);
            requireUnit("fineAttitudePenalty", fineAttitudePenalty);
            requireUnit("redemptionProbability", redemptionProbability);
            Objects.requireNonNull(targetingMode, "targetingMode cannot be null");
            if (patrolRange < 1) {
                throw new IllegalArgumentException("patrolRange must be >= 1, got " + patrolRange);
            }
            if (catchRadius < 0 || catchRadius > patrolRange) {
                throw new IllegalArgumentException(
                    "catchRadius must be in [0, patrolRange], got " + catchRadius);
            }
            return new BehaviorProfile(this);
        }

        private static void requireUnit(String name, double value) {
            if (!(value >= 0.0 && value <= 1.0)) {
                throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
            }
        }

        private static void requireNonNegative(String name, double value) {
            if (!(value >= 0.0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be a finite value >= 0, got " + value);
            }
        }
    }
}
