package org.carma.wastepolicy.simulation;

import org.carma.wastepolicy.mechanism.AllocationPolicy;
import org.carma.wastepolicy.mechanism.BuiltInPolicy;
import org.carma.wastepolicy.mechanism.RewardFunction;

import java.util.Objects;

/**
 * Budget, calendar and political parameters of a simulated term.
 *
 * The term budget is quarterlyBudget × maxQuarters, where the quarterly
 * budget is a quarter of the annual budget.
 */
public final class LedgerSettings {

    public static final LedgerSettings DEFAULT = new Builder().build();

    private final double annualBudget;
    private final int quarterLength;
    private final int maxQuarters;
    private final double initialPoliticalCapital;
    private final double erosionRate;
    private final double recoveryRate;
    private final AllocationPolicy defaultPolicy;
    private final RewardFunction rewardFunction;

    private LedgerSettings(Builder b) {
        this.annualBudget = b.annualBudget;
        this.quarterLength = b.quarterLength;
        this.maxQuarters = b.maxQuarters;
        this.initialPoliticalCapital = b.initialPoliticalCapital;
        this.erosionRate = b.erosionRate;
        this.recoveryRate = b.recoveryRate;
        this.defaultPolicy = b.defaultPolicy;
        this.rewardFunction = b.rewardFunction;
    }

    public double getAnnualBudget() { return annualBudget; }
    public double getQuarterlyBudget() { return annualBudget / 4.0; }
    public double getTermBudget() { return getQuarterlyBudget() * maxQuarters; }
    public int getQuarterLength() { return quarterLength; }
    public int getMaxQuarters() { return maxQuarters; }
    public long getMaxSteps() { return (long) quarterLength * maxQuarters; }
    public double getInitialPoliticalCapital() { return initialPoliticalCapital; }
    public double getErosionRate() { return erosionRate; }
    public double getRecoveryRate() { return recoveryRate; }
    public AllocationPolicy getDefaultPolicy() { return defaultPolicy; }
    public RewardFunction getRewardFunction() { return rewardFunction; }

    public Builder toBuilder() {
        return new Builder()
            .annualBudget(annualBudget)
            .quarterLength(quarterLength)
            .maxQuarters(maxQuarters)
            .initialPoliticalCapital(initialPoliticalCapital)
            .erosionRate(erosionRate)
            .recoveryRate(recoveryRate)
            .defaultPolicy(defaultPolicy)
            .rewardFunction(rewardFunction);
    }

    @Override
    public String toString() {
        return String.format("LedgerSettings[annual=%.0f, quarter=%d steps, quarters=%d, capital=%.2f]",
            annualBudget, quarterLength, maxQuarters, initialPoliticalCapital);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private double annualBudget = 20_000_000;
        private int quarterLength = 90;
        private int maxQuarters = 12;
        private double initialPoliticalCapital = 1.0;
        private double erosionRate = 0.003;
        private double recoveryRate = 0.001;
        private AllocationPolicy defaultPolicy = BuiltInPolicy.STATUS_QUO;
        private RewardFunction rewardFunction = new RewardFunction();

        public Builder annualBudget(double v) { this.annualBudget = v; return this; }
        public Builder quarterLength(int v) { this.quarterLength = v; return this; }
        public Builder maxQuarters(int v) { this.maxQuarters = v; return this; }
        public Builder initialPoliticalCapital(double v) { this.initialPoliticalCapital = v; return this; }
        public Builder erosionRate(double v) { this.erosionRate = v; return this; }
        public Builder recoveryRate(double v) { this.recoveryRate = v; return this; }
        public Builder defaultPolicy(AllocationPolicy v) { this.defaultPolicy = v; return this; }
        public Builder rewardFunction(RewardFunction v) { this.rewardFunction = v; return this; }

        public LedgerSettings build() {
            if (!(annualBudget >= 0.0) || Double.isInfinite(annualBudget)) {
                throw new IllegalArgumentException("annualBudget must be >= 0, got " + annualBudget);
            }
            if (quarterLength < 1) {
                throw new IllegalArgumentException("quarterLength must be >= 1, got " + quarterLength);
            }
            if (maxQuarters < 1) {
                throw new IllegalArgumentException("maxQuarters must be >= 1, got " + maxQuarters);
            }
            requireUnit("initialPoliticalCapital", initialPoliticalCapital);
            requireUnit("erosionRate", erosionRate);
            requireUnit("recoveryRate", recoveryRate);
            Objects.requireNonNull(defaultPolicy, "Default policy cannot be null");
            Objects.requireNonNull(rewardFunction, "Reward function cannot be null");
            return new LedgerSettings(this);
        }

        private static void requireUnit(String name, double v) {
            if (!(v >= 0.0 && v <= 1.0)) {
                throw new IllegalArgumentException(name + " must be in [0, 1], got " + v);
            }
        }
    }
}
