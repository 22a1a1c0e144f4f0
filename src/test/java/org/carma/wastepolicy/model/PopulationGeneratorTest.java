package org.carma.wastepolicy.model;

import org.carma.wastepolicy.space.GridPosition;
import org.carma.wastepolicy.space.MultiGrid;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PopulationGeneratorTest {

    private static RegionPolicy region(String id, int x, int y) {
        return new RegionPolicy(id, id, new GridPosition(x, y), PolicyCosts.DEFAULT, BehaviorProfile.DEFAULT);
    }

    @Test
    void householdsAreCreatedPlacedAndInitialised() {
        MultiGrid<SteppingAgent> grid = new MultiGrid<>(50, 50);
        RegionPolicy region = region("R1", 10, 10);

        new PopulationGenerator(new Random(42), grid, BehaviorProfile.DEFAULT).populate(region, 200, 0.4, 5.0);

        assertEquals(200, region.getPopulation());
        assertEquals("R1-H00001", region.getHouseholds().get(0).getId());
        for (Household h : region.getHouseholds()) {
            GridPosition pos = grid.positionOf(h);
            assertNotNull(pos);
            assertTrue(grid.contains(pos));
            assertEquals(h.isCompliant() ? 0.66 : 0.30, h.getAttitude(), 1e-12);
            assertEquals(0.5, h.getSubjectiveNorm(), 1e-12);
            assertTrue(h.getPerceivedControl() >= 0.2 && h.getPerceivedControl() <= 1.0);
        }
    }

    @Test
    void placementIsClippedToGrid() {
        MultiGrid<SteppingAgent> grid = new MultiGrid<>(5, 5);
        RegionPolicy region = region("R1", 0, 4);

        new PopulationGenerator(new Random(1), grid, BehaviorProfile.DEFAULT).populate(region, 100, 0.5, 10.0);

        assertEquals(100, grid.getAgentCount());
    }

    @Test
    void initialComplianceExtremesAreExact() {
        MultiGrid<SteppingAgent> grid = new MultiGrid<>(20, 20);
        RegionPolicy none = region("R1", 5, 5);
        RegionPolicy all = region("R2", 15, 15);
        PopulationGenerator generator = new PopulationGenerator(new Random(9), grid, BehaviorProfile.DEFAULT);

        generator.populate(none, 50, 0.0, 2.0);
        generator.populate(all, 50, 1.0, 2.0);

        assertEquals(0.0, none.getLocalCompliance());
        assertEquals(1.0, all.getLocalCompliance());
    }

    @Test
    void incomeTiersFollowPopulationShares() {
        MultiGrid<SteppingAgent> grid = new MultiGrid<>(50, 50);
        RegionPolicy region = region("R1", 25, 25);
        new PopulationGenerator(new Random(5), grid, BehaviorProfile.DEFAULT).populate(region, 5000, 0.5, 8.0);

        Map<IncomeTier, Integer> counts = new EnumMap<>(IncomeTier.class);
        for (Household h : region.getHouseholds()) {
            counts.merge(h.getIncomeTier(), 1, Integer::sum);
        }
        for (IncomeTier tier : IncomeTier.values()) {
            double share = counts.getOrDefault(tier, 0) / 5000.0;
            assertEquals(tier.getPopulationShare(), share, 0.03, tier.name());
        }
    }

    @Test
    void sameSeedSamePopulation() {
        List<Household> first = generate(77);
        List<Household> second = generate(77);

        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getIncomeTier(), second.get(i).getIncomeTier());
            assertEquals(first.get(i).isCompliant(), second.get(i).isCompliant());
            assertEquals(first.get(i).getPerceivedControl(), second.get(i).getPerceivedControl());
        }
    }

    @Test
    void invalidArgumentsAreRejected() {
        PopulationGenerator generator = new PopulationGenerator(new Random(1), new MultiGrid<>(5, 5),
            BehaviorProfile.DEFAULT);
        RegionPolicy region = region("R1", 2, 2);

        assertThrows(IllegalArgumentException.class, () -> generator.populate(region, -1, 0.5, 1.0));
        assertThrows(IllegalArgumentException.class, () -> generator.populate(region, 10, 1.5, 1.0));
        assertThrows(IllegalArgumentException.class, () -> generator.populate(region, 10, 0.5, -1.0));
    }

    private static List<Household> generate(long seed) {
        RegionPolicy region = region("R1", 10, 10);
        new PopulationGenerator(new Random(seed), new MultiGrid<>(30, 30), BehaviorProfile.DEFAULT)
            .populate(region, 100, 0.5, 4.0);
        return region.getHouseholds();
    }
}
