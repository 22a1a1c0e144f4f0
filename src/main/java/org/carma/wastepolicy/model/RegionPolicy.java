package org.carma.wastepolicy.model;

import org.carma.wastepolicy.space.GridPosition;
import org.carma.wastepolicy.space.SpatialIndex;

import java.util.*;

/**
 * A region (barangay) turning its quarterly funds into policy intensities.
 *
 * The region owns its households and enforcement units; it is the only path
 * by which they are counted, hired or released. Per quarter it receives three
 * fund pools:
 * <ul>
 *   <li>education: intensity = min(1, fund / (population × cost per household))</li>
 *   <li>enforcement: intensity = min(1, fund / area saturation), headcount =
 *       floor(fund / unit cost per quarter)</li>
 *   <li>incentive: per-capita value = fund / population, paid from a
 *       cash-on-hand pool that households drain by redeeming</li>
 * </ul>
 */
public class RegionPolicy implements SteppingAgent {

    private final String id;
    private final String name;
    private final GridPosition center;
    private final PolicyCosts costs;
    private final BehaviorProfile profile;
    private final List<Household> households;
    private final List<EnforcementUnit> units;
    private int unitSerial;

    private double educationFund;
    private double enforcementFund;
    private double incentiveFund;
    private double educationIntensity;
    private double enforcementIntensity;
    private double incentivePerCapita;
    private double cashOnHand;

    private int compliantCount;
    private double complianceRate;

    public RegionPolicy(String id, String name, GridPosition center,
                        PolicyCosts costs, BehaviorProfile profile) {
        this.id = Objects.requireNonNull(id, "Region ID cannot be null");
        this.name = Objects.requireNonNull(name, "Region name cannot be null");
        this.center = Objects.requireNonNull(center, "Region center cannot be null");
        this.costs = Objects.requireNonNull(costs, "Policy costs cannot be null");
        this.profile = Objects.requireNonNull(profile, "Behavior profile cannot be null");
        this.households = new ArrayList<>();
        this.units = new ArrayList<>();
    }

    // ========================================================================
    // Membership
    // ========================================================================

    /**
     * Attach a household created for this region.
     * @throws IllegalArgumentException if the household names another region
     */
    public void addHousehold(Household household) {
        if (!id.equals(household.getRegionId())) {
            throw new IllegalArgumentException(
                "Household " + household.getId() + " belongs to " + household.getRegionId()
                    + ", not " + id);
        }
        households.add(household);
    }

    public int getPopulation() {
        return households.size();
    }

    // ========================================================================
    // Policy Translation
    // ========================================================================

    /**
     * Store the quarter's funds and re-derive intensities, per-capita incentive
     * and the redeemable cash pool.
     */
    public void updatePolicy(double educationFund, double enforcementFund, double incentiveFund) {
        requireFund("educationFund", educationFund);
        requireFund("enforcementFund", enforcementFund);
        requireFund("incentiveFund", incentiveFund);

        this.educationFund = educationFund;
        this.enforcementFund = enforcementFund;
        this.incentiveFund = incentiveFund;

        int population = getPopulation();
        if (population > 0) {
            double saturationTarget = population * costs.getEducationCostPerHousehold();
            this.educationIntensity = Math.min(1.0, educationFund / saturationTarget);
            this.incentivePerCapita = incentiveFund / population;
        } else {
            this.educationIntensity = 0.0;
            this.incentivePerCapita = 0.0;
        }
        this.enforcementIntensity = Math.min(1.0, enforcementFund / costs.getEnforcementSaturation());
        this.cashOnHand = incentiveFund;
    }

    /**
     * Funded enforcement headcount: floor(enforcement fund / unit cost).
     */
    public int getTargetHeadcount() {
        return (int) Math.floor(enforcementFund / costs.getUnitCostPerQuarter());
    }

    /**
     * Hire or retire units until the headcount matches the funded target.
     * New units start at the region center; the most recently hired units are
     * retired first.
     *
     * @return change in headcount (positive for hires)
     */
    public int adjustEnforcementAgents(SpatialIndex<SteppingAgent> space) {
        int target = getTargetHeadcount();
        int before = units.size();

        while (units.size() < target) {
            unitSerial++;
            EnforcementUnit unit = new EnforcementUnit(
                String.format("%s-E%03d", id, unitSerial), id, profile);
            space.place(unit, center);
            units.add(unit);
        }
        while (units.size() > target) {
            EnforcementUnit retired = units.remove(units.size() - 1);
            space.remove(retired);
        }
        return units.size() - before;
    }

    /**
     * Clear every household's redemption flag for a new quarter.
     */
    public void resetRedemptions() {
        for (Household h : households) {
            h.resetRedemption();
        }
    }

    // ========================================================================
    // Compliance
    // ========================================================================

    @Override
    public void step(StepContext context) {
        getLocalCompliance();
    }

    /**
     * Recount compliant households. Repeated calls without an intervening
     * step return the same value.
     *
     * @return compliant share of the population, 0.0 for an empty region
     */
    public double getLocalCompliance() {
        int count = 0;
        for (Household h : households) {
            if (h.isCompliant()) count++;
        }
        compliantCount = count;
        complianceRate = households.isEmpty() ? 0.0 : (double) count / households.size();
        return complianceRate;
    }

    public int getCompliantCount() {
        return compliantCount;
    }

    /**
     * Rate from the most recent recount, without rescanning.
     */
    public double getLastComplianceRate() {
        return complianceRate;
    }

    // ========================================================================
    // Incentive Pool
    // ========================================================================

    /**
     * Pay an incentive from cash on hand.
     *
     * @return false, leaving the pool untouched, if cash on hand does not cover the amount
     */
    public boolean giveReward(double amount, Treasury treasury) {
        if (amount < 0) {
            throw new IllegalArgumentException("Reward cannot be negative");
        }
        if (cashOnHand < amount) {
            return false;
        }
        cashOnHand -= amount;
        treasury.recordIncentivePaid(amount);
        return true;
    }

    // ========================================================================
    // Utility Inputs
    // ========================================================================

    public double getFineAmount() {
        return costs.getFineAmount();
    }

    public double getNormalizedFine() {
        return costs.getFineAmount() / costs.getFineNormalization();
    }

    public double getNormalizedIncentive() {
        return incentivePerCapita / costs.getIncentiveNormalization();
    }

    /**
     * Incentive programme strength in [0, 1].
     */
    public double getIncentiveStrength() {
        return Math.min(1.0, getNormalizedIncentive());
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    @Override
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public GridPosition getCenter() {
        return center;
    }

    public PolicyCosts getCosts() {
        return costs;
    }

    public List<Household> getHouseholds() {
        return Collections.unmodifiableList(households);
    }

    public List<EnforcementUnit> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public int getHeadcount() {
        return units.size();
    }

    public double getEducationFund() { return educationFund; }
    public double getEnforcementFund() { return enforcementFund; }
    public double getIncentiveFund() { return incentiveFund; }
    public double getEducationIntensity() { return educationIntensity; }
    public double getEnforcementIntensity() { return enforcementIntensity; }
    public double getIncentivePerCapita() { return incentivePerCapita; }
    public double getCashOnHand() { return cashOnHand; }

    private static void requireFund(String name, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a finite value >= 0, got " + value);
        }
    }

    @Override
    public String toString() {
        return String.format(
            "RegionPolicy[%s: %s, households=%d, units=%d, edu=%.2f, enf=%.2f, compliance=%.2f]",
            id, name, households.size(), units.size(), educationIntensity, enforcementIntensity,
            complianceRate);
    }
}
