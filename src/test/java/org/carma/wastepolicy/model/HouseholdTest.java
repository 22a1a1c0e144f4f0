package org.carma.wastepolicy.model;

import org.carma.wastepolicy.event.Event;
import org.carma.wastepolicy.event.EventBus;
import org.carma.wastepolicy.space.GridPosition;
import org.carma.wastepolicy.space.MultiGrid;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HouseholdTest {

    private final MultiGrid<SteppingAgent> grid = new MultiGrid<>(20, 20);
    private final Treasury treasury = new Treasury(1_000_000);
    private final EventBus events = new EventBus();
    private final Random random = new Random(42);
    private final Map<String, RegionPolicy> regions = new HashMap<>();

    private RegionPolicy region(String id, BehaviorProfile profile) {
        RegionPolicy region = new RegionPolicy(id, "Region " + id, new GridPosition(10, 10),
            PolicyCosts.DEFAULT, profile);
        regions.put(id, region);
        return region;
    }

    private StepContext context(long step) {
        return new StepContext(step, random, grid, regions, treasury, events);
    }

    private static Household household(String id, String regionId, double attitude, double norm,
                                       double control, boolean compliant, BehaviorProfile profile) {
        return new Household(id, regionId, IncomeTier.LOW, attitude, norm, control, compliant, profile);
    }

    @Test
    void tpbStateStaysInUnitIntervalUnderHeavyPolicy() {
        RegionPolicy region = region("R1", BehaviorProfile.DEFAULT);
        Random setup = new Random(3);
        List<Household> households = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            Household h = household("R1-H" + i, "R1", setup.nextDouble(), setup.nextDouble(),
                setup.nextDouble(), setup.nextBoolean(), BehaviorProfile.DEFAULT);
            region.addHousehold(h);
            grid.place(h, new GridPosition(setup.nextInt(20), setup.nextInt(20)));
            households.add(h);
        }
        region.updatePolicy(1_000_000, 1_000_000, 30_000);

        for (long step = 0; step < 500; step++) {
            StepContext ctx = context(step);
            for (Household h : households) {
                h.step(ctx);
                if (!h.isCompliant() && step % 3 == 0) {
                    h.getFined(ctx);
                }
                assertInUnitInterval(h.getAttitude());
                assertInUnitInterval(h.getSubjectiveNorm());
                assertInUnitInterval(h.getPerceivedControl());
            }
        }
    }

    @Test
    void constructorRejectsOutOfRangeState() {
        assertThrows(IllegalArgumentException.class,
            () -> household("H", "R1", 1.2, 0.5, 0.5, false, BehaviorProfile.DEFAULT));
        assertThrows(IllegalArgumentException.class,
            () -> household("H", "R1", 0.5, -0.1, 0.5, false, BehaviorProfile.DEFAULT));
        assertThrows(IllegalArgumentException.class,
            () -> household("H", "R1", 0.5, 0.5, Double.NaN, false, BehaviorProfile.DEFAULT));
    }

    @Test
    void utilityIsDeterministicGivenNoise() {
        RegionPolicy region = region("R1", BehaviorProfile.DEFAULT);
        Household h = household("H", "R1", 0.5, 0.5, 0.5, false, BehaviorProfile.DEFAULT);

        double first = h.calculateUtility(region, 0.01);
        double second = h.calculateUtility(region, 0.01);

        assertEquals(first, second);
        // tpb 0.5 minus effort 0.15, no money in play
        assertEquals(0.36, first, 1e-9);
    }

    @Test
    void complianceRequiresUtilityAboveThreshold() {
        RegionPolicy region = region("R1", BehaviorProfile.DEFAULT);
        Household h = household("H", "R1", 0.5, 0.5, 0.5, false, BehaviorProfile.DEFAULT);

        assertTrue(h.decide(region, 0.2));
        assertEquals(0.55, h.getUtility(), 1e-9);
        assertFalse(h.decide(region, 0.1));
    }

    @Test
    void expectedFineRaisesUtilityOfComplying() {
        RegionPolicy region = region("R1", BehaviorProfile.DEFAULT);
        Household h = household("H", "R1", 0.5, 0.5, 0.5, false, BehaviorProfile.DEFAULT);
        double unenforced = h.calculateUtility(region, 0.0);

        region.updatePolicy(0, 375_000, 0);
        double enforced = h.calculateUtility(region, 0.0);

        // LOW tier: 1.5 × normalised fine 0.5 × intensity 1.0
        assertEquals(unenforced + 0.75, enforced, 1e-9);
    }

    @Test
    void attitudeDecaysWithoutPolicy() {
        RegionPolicy region = region("R1", BehaviorProfile.DEFAULT);
        Household h = household("H", "R1", 0.5, 0.5, 0.5, false, BehaviorProfile.DEFAULT);

        h.updateAttitude(region);

        assertEquals(0.495, h.getAttitude(), 1e-9);
    }

    @Test
    void educationBoostsAndHeavyEnforcementProvokesReactance() {
        RegionPolicy region = region("R1", BehaviorProfile.DEFAULT);
        Household h = household("H", "R1", 0.5, 0.5, 0.5, false, BehaviorProfile.DEFAULT);
        region.addHousehold(h);

        region.updatePolicy(650, 0, 0);
        h.updateAttitude(region);
        assertEquals(0.515, h.getAttitude(), 1e-9);

        region.updatePolicy(0, 375_000, 0);
        h.updateAttitude(region);
        assertEquals(0.508, h.getAttitude(), 1e-9);
    }

    @Test
    void isolatedHouseholdNormDriftsTowardNeutral() {
        region("R1", BehaviorProfile.DEFAULT);
        Household h = household("H", "R1", 0.5, 0.9, 0.5, false, BehaviorProfile.DEFAULT);
        grid.place(h, new GridPosition(5, 5));

        h.updateSubjectiveNorm(context(0));

        assertEquals(0.78, h.getSubjectiveNorm(), 1e-9);
    }

    @Test
    void normFollowsCompliantNeighboursOfSameRegionOnly() {
        region("R1", BehaviorProfile.DEFAULT);
        region("R2", BehaviorProfile.DEFAULT);
        Household h = household("H", "R1", 0.5, 0.5, 0.5, false, BehaviorProfile.DEFAULT);
        grid.place(h, new GridPosition(5, 5));
        grid.place(household("N1", "R1", 0.5, 0.5, 0.5, true, BehaviorProfile.DEFAULT), new GridPosition(6, 5));
        grid.place(household("N2", "R1", 0.5, 0.5, 0.5, true, BehaviorProfile.DEFAULT), new GridPosition(5, 7));
        grid.place(household("X1", "R2", 0.5, 0.5, 0.5, false, BehaviorProfile.DEFAULT), new GridPosition(4, 5));

        h.updateSubjectiveNorm(context(0));

        // raw 1.0 amplified and capped at 1.0, then smoothed with weight 0.3
        assertEquals(0.65, h.getSubjectiveNorm(), 1e-9);
    }

    @Test
    void symmetricNormsUseRawFraction() {
        BehaviorProfile symmetric = BehaviorProfile.DEFAULT.toBuilder().asymmetricNorms(false).build();
        region("R1", symmetric);
        Household h = household("H", "R1", 0.5, 0.5, 0.5, false, symmetric);
        grid.place(h, new GridPosition(5, 5));
        grid.place(household("N1", "R1", 0.5, 0.5, 0.5, false, symmetric), new GridPosition(6, 5));

        h.updateSubjectiveNorm(context(0));

        assertEquals(0.35, h.getSubjectiveNorm(), 1e-9);
    }

    @Test
    void fineAppliesOncePerStep() {
        region("R1", BehaviorProfile.DEFAULT);
        Household h = household("H", "R1", 0.3, 0.5, 0.5, false, BehaviorProfile.DEFAULT);

        StepContext step3 = context(3);
        assertTrue(h.getFined(step3));
        assertFalse(h.getFined(step3));

        assertEquals(1, h.getFinesReceived());
        assertEquals(0.29, h.getAttitude(), 1e-9);
        assertEquals(500.0, treasury.getFinesCollected());
        assertEquals(500.0, treasury.getRecentFines());
        assertEquals(1, events.getEventCount(Event.HouseholdFinedEvent.class));

        assertTrue(h.getFined(context(4)));
        assertEquals(2, h.getFinesReceived());
    }

    @Test
    void compliantHouseholdRedeemsOncePerQuarter() {
        BehaviorProfile eager = BehaviorProfile.DEFAULT.toBuilder()
            .redemptionProbability(1.0)
            .noiseStdDev(0.0)
            .build();
        RegionPolicy region = region("R1", eager);
        Household h1 = household("H1", "R1", 1.0, 1.0, 1.0, true, eager);
        Household h2 = household("H2", "R1", 1.0, 1.0, 1.0, true, eager);
        region.addHousehold(h1);
        region.addHousehold(h2);
        region.updatePolicy(0, 0, 1000);

        h1.step(context(0));
        assertTrue(h1.hasRedeemed());
        assertEquals(500.0, region.getCashOnHand(), 1e-9);
        assertEquals(500.0, treasury.getIncentivesPaid(), 1e-9);

        h1.step(context(1));
        assertEquals(1, h1.getIncentivesRedeemed());
        assertEquals(500.0, region.getCashOnHand(), 1e-9);

        List<Event.IncentiveRedeemedEvent> redeemed = events.getHistory(Event.IncentiveRedeemedEvent.class);
        assertEquals(1, redeemed.size());
        assertEquals("H1", redeemed.get(0).householdId());
    }

    @Test
    void claimAgainstEmptyPoolFailsSilently() {
        BehaviorProfile eager = BehaviorProfile.DEFAULT.toBuilder()
            .redemptionProbability(1.0)
            .noiseStdDev(0.0)
            .build();
        RegionPolicy region = region("R1", eager);
        Household h1 = household("H1", "R1", 1.0, 1.0, 1.0, true, eager);
        Household h2 = household("H2", "R1", 1.0, 1.0, 1.0, true, eager);
        region.addHousehold(h1);
        region.addHousehold(h2);
        region.updatePolicy(0, 0, 1000);

        h1.step(context(0));
        h2.step(context(0));
        assertEquals(0.0, region.getCashOnHand(), 1e-9);

        h1.resetRedemption();
        h1.step(context(1));

        assertFalse(h1.hasRedeemed());
        assertEquals(0.0, region.getCashOnHand(), 1e-9);
        assertEquals(1000.0, treasury.getIncentivesPaid(), 1e-9);
    }

    @Test
    void redeemedIncentiveNoLongerPullsUtility() {
        BehaviorProfile eager = BehaviorProfile.DEFAULT.toBuilder()
            .redemptionProbability(1.0)
            .noiseStdDev(0.0)
            .build();
        RegionPolicy region = region("R1", eager);
        Household h = household("H", "R1", 1.0, 1.0, 1.0, true, eager);
        region.addHousehold(h);
        region.updatePolicy(0, 0, 400);

        h.step(context(0));

        assertTrue(h.hasRedeemed());
        double tpb = 0.4 * h.getAttitude() + 0.3 * h.getSubjectiveNorm() + 0.3 * h.getPerceivedControl();
        assertEquals(tpb - 0.15, h.calculateUtility(region, 0.0), 1e-9);
    }

    private static void assertInUnitInterval(double value) {
        assertTrue(value >= 0.0 && value <= 1.0, "value out of [0, 1]: " + value);
    }
}
