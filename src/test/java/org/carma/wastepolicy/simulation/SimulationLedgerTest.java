package org.carma.wastepolicy.simulation;

import org.carma.wastepolicy.event.Event;
import org.carma.wastepolicy.event.EventBus;
import org.carma.wastepolicy.mechanism.BuiltInPolicy;
import org.carma.wastepolicy.model.*;
import org.carma.wastepolicy.space.GridPosition;
import org.carma.wastepolicy.space.MultiGrid;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SimulationLedgerTest {

    private static final LedgerSettings SMALL_BUDGET = LedgerSettings.DEFAULT.toBuilder()
        .annualBudget(720_000)
        .build();

    private static SimulationLedger ledger(long seed, LedgerSettings settings, int households, double compliance) {
        Random random = new Random(seed);
        MultiGrid<SteppingAgent> grid = new MultiGrid<>(20, 20);
        RegionPolicy region = new RegionPolicy("R1", "Region One", new GridPosition(10, 10),
            PolicyCosts.DEFAULT, BehaviorProfile.DEFAULT);
        new PopulationGenerator(random, grid, BehaviorProfile.DEFAULT).populate(region, households, compliance, 3.0);
        return new SimulationLedger(settings, List.of(region), grid, random, new EventBus());
    }

    // ========================================================================
    // Construction
    // ========================================================================

    @Test
    void rejectsEmptyOrDuplicateRegions() {
        MultiGrid<SteppingAgent> grid = new MultiGrid<>(5, 5);
        assertThrows(IllegalArgumentException.class,
            () -> new SimulationLedger(LedgerSettings.DEFAULT, List.of(), grid, new Random(1), new EventBus()));

        RegionPolicy a = new RegionPolicy("R1", "A", new GridPosition(1, 1), PolicyCosts.DEFAULT, BehaviorProfile.DEFAULT);
        RegionPolicy b = new RegionPolicy("R1", "B", new GridPosition(2, 2), PolicyCosts.DEFAULT, BehaviorProfile.DEFAULT);
        assertThrows(IllegalArgumentException.class,
            () -> new SimulationLedger(LedgerSettings.DEFAULT, List.of(a, b), grid, new Random(1), new EventBus()));
    }

    @Test
    void initialStateHasFullBudgetAndNoElapsedTime() {
        SimulationLedger ledger = ledger(1, SMALL_BUDGET, 30, 0.5);

        double[] state = ledger.getState();

        assertEquals(4, state.length);
        assertEquals(ledger.getRegion("R1").getLastComplianceRate(), state[0]);
        assertEquals(1.0, state[1]);
        assertEquals(0.0, state[2]);
        assertEquals(1.0, state[3]);
        assertEquals(-1, ledger.getQuarter());
    }

    // ========================================================================
    // Allocation
    // ========================================================================

    @Test
    void enforcementFundSetsHeadcountAtQuarterBoundary() {
        LedgerSettings settings = SMALL_BUDGET.toBuilder().quarterLength(5).build();
        SimulationLedger ledger = ledger(3, settings, 20, 0.5);
        RegionPolicy region = ledger.getRegion("R1");

        ledger.submitAllocation(new double[] {0.0, 0.75, 0.0});
        ledger.step();
        assertEquals(3, region.getHeadcount());
        assertEquals(23, ledger.getSpace().getAgentCount());

        ledger.runQuarter();
        assertEquals(5, ledger.getStep());

        ledger.submitAllocation(new double[] {0.0, 0.625, 0.0});
        ledger.step();
        assertEquals(2, region.getHeadcount());
        assertEquals(22, ledger.getSpace().getAgentCount());

        List<Event.HeadcountChangedEvent> changes = ledger.getEvents().getHistory(Event.HeadcountChangedEvent.class);
        assertEquals(2, changes.size());
        assertEquals(3, changes.get(1).previousCount());
        assertEquals(2, changes.get(1).currentCount());
    }

    @Test
    void overAllocationIsScaledToQuarterlyBudget() {
        SimulationLedger ledger = ledger(4, SMALL_BUDGET, 10, 0.5);

        ledger.submitAllocation(new double[] {1.0, 1.0, 1.0});
        ledger.step();

        assertTrue(ledger.getCurrentAllocation().getTotal() <= 180_000 + 1e-6);
        assertEquals(1.0 / 3.0, ledger.getCurrentAllocation().getScaleFactor(), 1e-12);
    }

    @Test
    void malformedAllocationIsRejectedAtSubmission() {
        SimulationLedger ledger = ledger(5, SMALL_BUDGET, 10, 0.5);

        assertThrows(IllegalArgumentException.class, () -> ledger.submitAllocation(new double[2]));
        assertThrows(IllegalArgumentException.class, () -> ledger.submitAllocation(new double[] {-1, 0, 0}));
        assertEquals(0, ledger.getStep());
    }

    @Test
    void quarterStartRecordsWhetherControllerSupplied() {
        LedgerSettings settings = SMALL_BUDGET.toBuilder().quarterLength(3).build();
        SimulationLedger ledger = ledger(6, settings, 10, 0.5);

        ledger.submitAllocation(new double[] {0.1, 0.1, 0.1});
        ledger.runQuarter();
        ledger.runQuarter();

        List<Event.QuarterStartedEvent> starts = ledger.getEvents().getHistory(Event.QuarterStartedEvent.class);
        assertEquals(2, starts.size());
        assertTrue(starts.get(0).controllerSupplied());
        assertFalse(starts.get(1).controllerSupplied());
        assertEquals(1, starts.get(1).quarter());
    }

    // ========================================================================
    // Budget
    // ========================================================================

    @Test
    void oneDayOfSpendIsDeductedPerStep() {
        LedgerSettings settings = SMALL_BUDGET.toBuilder().maxQuarters(1).build();
        SimulationLedger ledger = ledger(7, settings, 10, 0.5);

        ledger.submitAllocation(new double[] {0.5, 0.0, 0.0});
        StepObservation observation = ledger.step();

        assertEquals(179_000.0, observation.cashBalance(), 1e-6);
        assertEquals(1000.0, ledger.getTreasury().getEducationSpend(), 1e-6);
    }

    @Test
    void zeroFundingLetsAttitudesDecay() {
        LedgerSettings settings = LedgerSettings.DEFAULT.toBuilder()
            .defaultPolicy(BuiltInPolicy.NONE)
            .maxQuarters(1)
            .build();
        SimulationLedger ledger = ledger(8, settings, 100, 0.6);
        RegionPolicy region = ledger.getRegion("R1");
        double initialCompliance = region.getLastComplianceRate();
        Map<String, Double> initialAttitudes = new HashMap<>();
        for (Household h : region.getHouseholds()) {
            initialAttitudes.put(h.getId(), h.getAttitude());
        }

        while (ledger.isRunning()) {
            ledger.step();
        }

        assertEquals(90, ledger.getStep());
        for (Household h : region.getHouseholds()) {
            double expected = Math.max(0.0, initialAttitudes.get(h.getId()) - 90 * 0.005);
            assertEquals(expected, h.getAttitude(), 1e-9, h.getId());
        }
        assertEquals(0, region.getHeadcount());
        assertEquals(0, ledger.getTotalFines());
        assertEquals(settings.getTermBudget(), ledger.getTreasury().getCashBalance());
        assertTrue(region.getLastComplianceRate() < initialCompliance);
    }

    // ========================================================================
    // Enforcement
    // ========================================================================

    @Test
    void householdReachedByManyUnitsIsFinedOncePerStep() {
        BehaviorProfile quiet = BehaviorProfile.DEFAULT.toBuilder().noiseStdDev(0.0).build();
        MultiGrid<SteppingAgent> grid = new MultiGrid<>(20, 20);
        RegionPolicy region = new RegionPolicy("R1", "Region One", new GridPosition(10, 10),
            PolicyCosts.DEFAULT, quiet);
        Household target = new Household("R1-H00001", "R1", IncomeTier.LOW, 0.0, 0.0, 0.0, false, quiet);
        region.addHousehold(target);
        grid.place(target, new GridPosition(10, 10));
        SimulationLedger ledger = new SimulationLedger(SMALL_BUDGET, List.of(region), grid,
            new Random(9), new EventBus());

        ledger.submitAllocation(new double[] {0.0, 0.75, 0.0});
        for (int i = 0; i < 10; i++) {
            StepObservation observation = ledger.step();
            assertEquals(1, observation.finesIssued());
        }

        assertEquals(3, region.getHeadcount());
        assertFalse(target.isCompliant());
        assertEquals(10, target.getFinesReceived());
        assertEquals(10, ledger.getTotalFines());
        assertEquals(10, region.getUnits().stream().mapToInt(EnforcementUnit::getFinesIssued).sum());
        assertEquals(10, ledger.getEvents().getEventCount(Event.HouseholdFinedEvent.class));
        assertEquals(10 * PolicyCosts.DEFAULT.getFineAmount(), ledger.getTreasury().getFinesCollected(), 1e-9);
    }

    // ========================================================================
    // Term
    // ========================================================================

    @Test
    void stateStaysBoundedOverWholeTerm() {
        LedgerSettings settings = SMALL_BUDGET.toBuilder()
            .defaultPolicy(BuiltInPolicy.UNIFORM)
            .quarterLength(5)
            .maxQuarters(4)
            .build();
        SimulationLedger ledger = ledger(10, settings, 40, 0.5);

        while (ledger.isRunning()) {
            ledger.step();
            double[] state = ledger.getState();
            assertEquals(4, state.length);
            for (double v : state) {
                assertTrue(v >= 0.0 && v <= 1.0, "state value " + v);
            }
        }

        assertEquals(1.0, ledger.getState()[2]);
        assertEquals(20, ledger.getMetrics().getStepCount());
    }

    @Test
    void steppingAfterTermEndsFails() {
        LedgerSettings settings = SMALL_BUDGET.toBuilder().quarterLength(3).maxQuarters(1).build();
        SimulationLedger ledger = ledger(11, settings, 10, 0.5);

        StepObservation last = ledger.runQuarter();

        assertEquals(3, last.step());
        assertFalse(ledger.isRunning());
        assertThrows(IllegalStateException.class, ledger::step);
    }

    @Test
    void quarterReportsCarryAllocationShares() {
        LedgerSettings settings = SMALL_BUDGET.toBuilder().quarterLength(5).build();
        SimulationLedger ledger = ledger(12, settings, 20, 0.5);

        ledger.submitAllocation(new double[] {0.2, 0.3, 0.1});
        ledger.runQuarter();

        List<QuarterReport> reports = ledger.getQuarterReports();
        assertEquals(1, reports.size());
        QuarterReport report = reports.get(0);
        assertEquals(0, report.quarter());
        assertEquals("R1", report.regionId());
        assertEquals(20.0, report.educationPercent(), 1e-9);
        assertEquals(30.0, report.enforcementPercent(), 1e-9);
        assertEquals(10.0, report.incentivePercent(), 1e-9);
        assertEquals(1, report.enforcementHeadcount());
        assertEquals(ledger.getRegion("R1").getLastComplianceRate(), report.complianceRate());
    }

    @Test
    void rewardCalculationHasNoSideEffects() {
        SimulationLedger ledger = ledger(13, SMALL_BUDGET, 30, 0.5);
        ledger.step();
        double[] before = ledger.getState();

        double first = ledger.calculateReward();
        double second = ledger.calculateReward();

        assertEquals(first, second);
        assertArrayEquals(before, ledger.getState());
        assertEquals(1, ledger.getStep());
    }

    @Test
    void sameSeedReproducesTrajectory() {
        LedgerSettings settings = SMALL_BUDGET.toBuilder()
            .defaultPolicy(BuiltInPolicy.UNIFORM)
            .quarterLength(10)
            .maxQuarters(3)
            .build();

        List<StepObservation> first = run(ledger(42, settings, 60, 0.4));
        List<StepObservation> second = run(ledger(42, settings, 60, 0.4));

        assertEquals(first, second);
    }

    private static List<StepObservation> run(SimulationLedger ledger) {
        List<StepObservation> observations = new ArrayList<>();
        while (ledger.isRunning()) {
            observations.add(ledger.step());
        }
        return observations;
    }
}
