package org.carma.wastepolicy.model;

import org.carma.wastepolicy.event.Event;
import org.carma.wastepolicy.space.GridPosition;

import java.util.Objects;

/**
 * A household deciding each step whether to segregate its waste.
 *
 * Each household has:
 * - Identity, owning region id and income tier
 * - Theory of Planned Behavior state: attitude, subjective norm and
 *   perceived behavioural control, all kept in [0, 1]
 * - The utility computed in the latest step and the resulting compliance flag
 * - A per-quarter incentive redemption flag
 *
 * A step runs attitude update, social-norm update, the compliance decision
 * and finally the optional incentive redemption. The only writes that leave
 * the household go through {@link #getFined} and
 * {@link RegionPolicy#giveReward}.
 */
public class Household implements SteppingAgent {

    private final String id;
    private final String regionId;
    private final IncomeTier incomeTier;
    private final BehaviorProfile profile;

    private double attitude;
    private double subjectiveNorm;
    private double perceivedControl;
    private double utility;
    private boolean compliant;
    private boolean redeemed;

    private long lastFinedStep = -1;
    private int finesReceived;
    private int incentivesRedeemed;

    public Household(String id, String regionId, IncomeTier incomeTier,
                     double attitude, double subjectiveNorm, double perceivedControl,
                     boolean compliant, BehaviorProfile profile) {
        this.id = Objects.requireNonNull(id, "Household ID cannot be null");
        this.regionId = Objects.requireNonNull(regionId, "Region ID cannot be null");
        this.incomeTier = Objects.requireNonNull(incomeTier, "Income tier cannot be null");
        this.profile = Objects.requireNonNull(profile, "Behavior profile cannot be null");
        this.attitude = requireUnit("attitude", attitude);
        this.subjectiveNorm = requireUnit("subjectiveNorm", subjectiveNorm);
        this.perceivedControl = requireUnit("perceivedControl", perceivedControl);
        this.compliant = compliant;
        this.utility = 0.0;
    }

    // ========================================================================
    // Step
    // ========================================================================

    @Override
    public void step(StepContext context) {
        RegionPolicy region = context.region(regionId);
        updateAttitude(region);
        updateSubjectiveNorm(context);
        double noise = context.getRandom().nextGaussian() * profile.getNoiseStdDev();
        decide(region, noise);
        tryRedeem(context, region);
    }

    /**
     * Natural decay, education boost and reactance against heavy enforcement.
     */
    public void updateAttitude(RegionPolicy region) {
        double next = attitude - profile.getAttitudeDecayRate();
        next += region.getEducationIntensity() * profile.getEducationBoost();
        if (region.getEnforcementIntensity() > profile.getReactanceThreshold()) {
            next -= profile.getReactancePenalty();
        }
        attitude = clamp(next);
    }

    /**
     * Blend the current norm toward the compliant share of same-region
     * neighbours. A household with no such neighbours drifts toward 0.5.
     */
    public void updateSubjectiveNorm(StepContext context) {
        double target = 0.5;
        GridPosition pos = context.getSpace().positionOf(this);
        if (pos != null) {
            int total = 0;
            int compliantCount = 0;
            for (SteppingAgent agent : context.getSpace().neighbors(pos, profile.getNormRadius())) {
                if (agent == this || !(agent instanceof Household)) continue;
                Household neighbour = (Household) agent;
                if (!neighbour.regionId.equals(regionId)) continue;
                total++;
                if (neighbour.compliant) compliantCount++;
            }
            if (total > 0) {
                target = profile.shapeNorm((double) compliantCount / total);
            }
        }
        double w = profile.getNormSmoothing();
        subjectiveNorm = clamp((1.0 - w) * subjectiveNorm + w * target);
    }

    /**
     * Compute utility for the given noise draw and set the compliance flag.
     * @return the new compliance flag
     */
    public boolean decide(RegionPolicy region, double noise) {
        utility = calculateUtility(region, noise);
        compliant = utility > decisionThreshold(region);
        return compliant;
    }

    /**
     * Utility of complying; pure given the noise draw.
     */
    public double calculateUtility(RegionPolicy region, double noise) {
        double tpb = profile.getAttitudeWeight() * attitude
            + profile.getNormWeight() * subjectiveNorm
            + profile.getControlWeight() * perceivedControl;

        double incentive = redeemed ? 0.0 : region.getNormalizedIncentive();
        double expectedFine = region.getNormalizedFine() * region.getEnforcementIntensity();
        double netCost = profile.getEffortCost()
            - incomeTier.getIncomeWeight() * (incentive + expectedFine);

        return tpb - netCost + noise;
    }

    /**
     * Compliance threshold, lowered by the strength of the region's incentive programme.
     */
    public double decisionThreshold(RegionPolicy region) {
        return profile.getComplianceThreshold()
            - profile.getThresholdRelief() * region.getIncentiveStrength();
    }

    // ========================================================================
    // Incentive redemption
    // ========================================================================

    /**
     * A compliant household that has not yet redeemed this quarter visits the
     * region office with a small probability. A claim against an empty pool
     * fails silently and can be retried on a later step.
     */
    private void tryRedeem(StepContext context, RegionPolicy region) {
        if (!compliant || redeemed) return;
        double amount = region.getIncentivePerCapita();
        if (amount <= 0.0) return;
        if (context.getRandom().nextDouble() >= profile.getRedemptionProbability()) return;

        if (region.giveReward(amount, context.getTreasury())) {
            redeemed = true;
            incentivesRedeemed++;
            context.getEvents().publish(new Event.IncentiveRedeemedEvent(
                context.getStep(), id, regionId, amount));
        }
    }

    /**
     * Clear the redemption flag at a quarter boundary.
     */
    public void resetRedemption() {
        redeemed = false;
    }

    // ========================================================================
    // Enforcement
    // ========================================================================

    /**
     * Apply a fine from an enforcement unit. A household is fined at most
     * once per step, however many units reach it.
     *
     * @return true if a fine was applied
     */
    public boolean getFined(StepContext context) {
        if (lastFinedStep == context.getStep()) {
            return false;
        }
        lastFinedStep = context.getStep();
        finesReceived++;

        utility -= profile.getFineUtilityPenalty();
        attitude = clamp(attitude - profile.getFineAttitudePenalty());

        double amount = context.region(regionId).getFineAmount();
        context.getTreasury().recordFine(amount);
        context.getEvents().publish(new Event.HouseholdFinedEvent(
            context.getStep(), id, regionId, amount));
        return true;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    @Override
    public String getId() {
        return id;
    }

    public String getRegionId() {
        return regionId;
    }

    public IncomeTier getIncomeTier() {
        return incomeTier;
    }

    public BehaviorProfile getProfile() {
        return profile;
    }

    public double getAttitude() {
        return attitude;
    }

    public double getSubjectiveNorm() {
        return subjectiveNorm;
    }

    public double getPerceivedControl() {
        return perceivedControl;
    }

    public double getUtility() {
        return utility;
    }

    public boolean isCompliant() {
        return compliant;
    }

    public boolean hasRedeemed() {
        return redeemed;
    }

    public int getFinesReceived() {
        return finesReceived;
    }

    public int getIncentivesRedeemed() {
        return incentivesRedeemed;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double requireUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
        }
        return value;
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Household other = (Household) o;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("Household[%s@%s, %s, att=%.3f, norm=%.3f, pbc=%.3f, compliant=%s]",
            id, regionId, incomeTier, attitude, subjectiveNorm, perceivedControl, compliant);
    }
}
