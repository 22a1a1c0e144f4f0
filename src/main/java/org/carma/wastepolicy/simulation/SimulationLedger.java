package org.carma.wastepolicy.simulation;

import org.carma.wastepolicy.event.Event;
import org.carma.wastepolicy.event.EventBus;
import org.carma.wastepolicy.mechanism.AllocationScaler;
import org.carma.wastepolicy.mechanism.FundAllocation;
import org.carma.wastepolicy.mechanism.PoliticalCapital;
import org.carma.wastepolicy.mechanism.RewardFunction;
import org.carma.wastepolicy.mechanism.ScaledAllocation;
import org.carma.wastepolicy.model.*;
import org.carma.wastepolicy.space.SpatialIndex;

import java.util.*;

/**
 * The model: owns the regions and advances simulated time.
 *
 * Per step:
 * <ol>
 *   <li>At a quarter boundary, apply the pending controller allocation (or the
 *       default policy), scaled to the quarterly budget; re-derive every
 *       region's intensities and headcount and reset redemption flags.</li>
 *   <li>Recount every region, then step every household and enforcement unit
 *       once in an order shuffled by the ledger's generator.</li>
 *   <li>Update political capital from the average enforcement intensity.</li>
 *   <li>Deduct one day of amortised spend and fold recent fines back into cash.</li>
 *   <li>Record a {@link StepObservation}; at the end of a quarter, one
 *       {@link QuarterReport} per region.</li>
 * </ol>
 *
 * The same seed, population and allocation sequence always yield the same
 * trajectory: every random draw comes from the single generator passed in.
 */
public class SimulationLedger {

    private final LedgerSettings settings;
    private final List<RegionPolicy> regions;
    private final Map<String, RegionPolicy> regionIndex;
    private final SpatialIndex<SteppingAgent> space;
    private final Random random;
    private final EventBus events;
    private final AllocationScaler scaler;
    private final Treasury treasury;
    private final PoliticalCapital politicalCapital;
    private final SimulationMetrics metrics;
    private final List<QuarterReport> quarterReports;

    private ScaledAllocation pendingAllocation;
    private ScaledAllocation currentAllocation;
    private long step;
    private int quarter = -1;
    private boolean running = true;
    private int totalFines;

    public SimulationLedger(LedgerSettings settings, List<RegionPolicy> regions,
                            SpatialIndex<SteppingAgent> space, Random random, EventBus events) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
        this.space = Objects.requireNonNull(space, "Space cannot be null");
        this.random = Objects.requireNonNull(random, "Random cannot be null");
        this.events = Objects.requireNonNull(events, "Event bus cannot be null");
        Objects.requireNonNull(regions, "Regions cannot be null");
        if (regions.isEmpty()) {
            throw new IllegalArgumentException("At least one region is required");
        }

        this.regions = List.copyOf(regions);
        this.regionIndex = new LinkedHashMap<>();
        for (RegionPolicy region : this.regions) {
            if (regionIndex.put(region.getId(), region) != null) {
                throw new IllegalArgumentException("Duplicate region ID: " + region.getId());
            }
            region.getLocalCompliance();
        }

        this.scaler = new AllocationScaler();
        this.treasury = new Treasury(settings.getTermBudget());
        this.politicalCapital = new PoliticalCapital(
            settings.getInitialPoliticalCapital(), settings.getErosionRate(), settings.getRecoveryRate());
        this.metrics = new SimulationMetrics();
        this.quarterReports = new ArrayList<>();
        this.currentAllocation = new ScaledAllocation(
            Collections.nCopies(this.regions.size(), FundAllocation.ZERO), 0.0, settings.getQuarterlyBudget());
    }

    // ========================================================================
    // Controller Interface
    // ========================================================================

    /**
     * Queue an allocation vector for the next quarter boundary. The vector is
     * validated and scaled immediately; a later submission before the boundary
     * replaces an earlier one.
     *
     * @param action three budget fractions per region, in region order
     * @throws IllegalArgumentException for a malformed vector
     */
    public void submitAllocation(double[] action) {
        pendingAllocation = scaler.scale(action, regions.size(), settings.getQuarterlyBudget());
    }

    /**
     * Fixed-length observation: one compliance rate per region, remaining
     * budget fraction, elapsed time fraction and political capital, all in [0, 1].
     */
    public double[] getState() {
        double[] state = new double[regions.size() + 3];
        for (int i = 0; i < regions.size(); i++) {
            state[i] = clamp(regions.get(i).getLastComplianceRate());
        }
        state[regions.size()] = treasury.getRemainingFraction();
        state[regions.size() + 1] = clamp(getElapsedFraction());
        state[regions.size() + 2] = clamp(politicalCapital.getValue());
        return state;
    }

    /**
     * Reward for the current ledger state. Has no side effects.
     */
    public double calculateReward() {
        return settings.getRewardFunction().calculate(
            getAverageCompliance(),
            treasury.getRemainingFraction(),
            getElapsedFraction(),
            getAverageEnforcementIntensity());
    }

    // ========================================================================
    // Stepping
    // ========================================================================

    /**
     * Advance the simulation by one step.
     * @throws IllegalStateException once the term has ended
     */
    public StepObservation step() {
        if (!running) {
            throw new IllegalStateException("Term has ended after " + step + " steps");
        }

        if (step % settings.getQuarterLength() == 0) {
            startQuarter();
        }

        StepContext context = new StepContext(step, random, space, regionIndex, treasury, events);

        for (RegionPolicy region : regions) {
            region.step(context);
        }

        List<SteppingAgent> agents = new ArrayList<>();
        for (RegionPolicy region : regions) {
            agents.addAll(region.getHouseholds());
            agents.addAll(region.getUnits());
        }
        Collections.shuffle(agents, random);
        for (SteppingAgent agent : agents) {
            agent.step(context);
        }

        for (RegionPolicy region : regions) {
            region.getLocalCompliance();
        }
        int finesThisStep = countFines() - totalFines;
        totalFines += finesThisStep;

        double avgEnforcement = getAverageEnforcementIntensity();
        politicalCapital.update(avgEnforcement);

        double days = settings.getQuarterLength();
        treasury.settleDay(
            currentAllocation.getTotalEducation() / days,
            currentAllocation.getTotalEnforcement() / days,
            currentAllocation.getTotalIncentive() / days);

        step++;
        if (step >= settings.getMaxSteps()) {
            running = false;
        }

        StepObservation observation = new StepObservation(
            step, quarter, getAverageCompliance(), avgEnforcement, politicalCapital.getValue(),
            treasury.getCashBalance(), treasury.getRemainingFraction(), calculateReward(), finesThisStep);
        metrics.recordStep(observation);

        if (step % settings.getQuarterLength() == 0) {
            recordQuarterReports();
        }

        events.publish(new Event.SimulationTickEvent(
            step, observation.averageCompliance(), observation.politicalCapital(), observation.cashBalance()));
        return observation;
    }

    /**
     * Step until the end of the current quarter or the term.
     * @return the last observation
     */
    public StepObservation runQuarter() {
        StepObservation last;
        do {
            last = step();
        } while (running && step % settings.getQuarterLength() != 0);
        return last;
    }

    private void startQuarter() {
        quarter = (int) (step / settings.getQuarterLength());

        boolean controllerSupplied = pendingAllocation != null;
        ScaledAllocation allocation = controllerSupplied
            ? pendingAllocation
            : scaler.scale(settings.getDefaultPolicy().allocate(quarter, regions),
                regions.size(), settings.getQuarterlyBudget());
        pendingAllocation = null;
        currentAllocation = allocation;

        events.publish(new Event.QuarterStartedEvent(
            step, quarter, allocation.getTotal(), allocation.getScaleFactor(), controllerSupplied));

        for (int i = 0; i < regions.size(); i++) {
            RegionPolicy region = regions.get(i);
            FundAllocation funds = allocation.getRegion(i);

            region.updatePolicy(funds.education(), funds.enforcement(), funds.incentive());
            int before = region.getHeadcount();
            int delta = region.adjustEnforcementAgents(space);
            region.resetRedemptions();

            events.publish(new Event.AllocationAppliedEvent(
                step, region.getId(), funds.education(), funds.enforcement(), funds.incentive(),
                region.getEducationIntensity(), region.getEnforcementIntensity()));
            if (delta != 0) {
                events.publish(new Event.HeadcountChangedEvent(
                    step, region.getId(), before, region.getHeadcount()));
            }
        }
    }

    private void recordQuarterReports() {
        for (int i = 0; i < regions.size(); i++) {
            RegionPolicy region = regions.get(i);
            FundAllocation funds = currentAllocation.getRegion(i);
            quarterReports.add(new QuarterReport(
                quarter,
                region.getId(),
                region.getName(),
                currentAllocation.shareOfBudget(funds.education()) * 100.0,
                currentAllocation.shareOfBudget(funds.enforcement()) * 100.0,
                currentAllocation.shareOfBudget(funds.incentive()) * 100.0,
                region.getLastComplianceRate(),
                region.getHeadcount()));
        }
    }

    private int countFines() {
        int count = 0;
        for (RegionPolicy region : regions) {
            for (Household h : region.getHouseholds()) {
                count += h.getFinesReceived();
            }
        }
        return count;
    }

    // ========================================================================
    // Aggregates
    // ========================================================================

    /**
     * Unweighted mean of regional compliance rates.
     */
    public double getAverageCompliance() {
        return regions.stream().mapToDouble(RegionPolicy::getLastComplianceRate).average().orElse(0.0);
    }

    public double getAverageEnforcementIntensity() {
        return regions.stream().mapToDouble(RegionPolicy::getEnforcementIntensity).average().orElse(0.0);
    }

    public double getElapsedFraction() {
        return (double) step / settings.getMaxSteps();
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public LedgerSettings getSettings() { return settings; }
    public List<RegionPolicy> getRegions() { return regions; }
    public SpatialIndex<SteppingAgent> getSpace() { return space; }
    public EventBus getEvents() { return events; }
    public Treasury getTreasury() { return treasury; }
    public PoliticalCapital getPoliticalCapital() { return politicalCapital; }
    public SimulationMetrics getMetrics() { return metrics; }
    public ScaledAllocation getCurrentAllocation() { return currentAllocation; }
    public long getStep() { return step; }
    public boolean isRunning() { return running; }
    public int getTotalFines() { return totalFines; }

    /**
     * Zero-based index of the quarter in progress, -1 before the first step.
     */
    public int getQuarter() { return quarter; }

    public List<QuarterReport> getQuarterReports() {
        return Collections.unmodifiableList(quarterReports);
    }

    public RegionPolicy getRegion(String regionId) {
        RegionPolicy region = regionIndex.get(regionId);
        if (region == null) {
            throw new IllegalArgumentException("Unknown region: " + regionId);
        }
        return region;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    @Override
    public String toString() {
        return String.format("SimulationLedger[step=%d, quarter=%d, regions=%d, compliance=%.3f, capital=%.3f]",
            step, quarter, regions.size(), getAverageCompliance(), politicalCapital.getValue());
    }
}
