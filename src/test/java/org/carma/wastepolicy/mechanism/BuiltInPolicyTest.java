package org.carma.wastepolicy.mechanism;

import org.carma.wastepolicy.model.BehaviorProfile;
import org.carma.wastepolicy.model.Household;
import org.carma.wastepolicy.model.IncomeTier;
import org.carma.wastepolicy.model.PolicyCosts;
import org.carma.wastepolicy.model.RegionPolicy;
import org.carma.wastepolicy.space.GridPosition;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BuiltInPolicyTest {

    private static RegionPolicy region(String id, int households) {
        RegionPolicy region = new RegionPolicy(id, id, new GridPosition(0, 0),
            PolicyCosts.DEFAULT, BehaviorProfile.DEFAULT);
        for (int i = 0; i < households; i++) {
            region.addHousehold(new Household(id + "-H" + i, id, IncomeTier.MID, 0.5, 0.5, 0.5, false,
                BehaviorProfile.DEFAULT));
        }
        return region;
    }

    @Test
    void statusQuoSpendsSixtyPercentWeightedByPopulation() {
        double[] action = BuiltInPolicy.STATUS_QUO.allocate(0, List.of(region("A", 3), region("B", 1)));

        assertEquals(6, action.length);
        assertEquals(0.6, Arrays.stream(action).sum(), 1e-12);
        assertEquals(0.6 * 0.75 * 0.5, action[0], 1e-12);
        assertEquals(0.6 * 0.75 * 0.3, action[1], 1e-12);
        assertEquals(0.6 * 0.25 * 0.2, action[5], 1e-12);
    }

    @Test
    void statusQuoSplitsEvenlyWithoutPopulation() {
        double[] action = BuiltInPolicy.STATUS_QUO.allocate(0, List.of(region("A", 0), region("B", 0)));

        assertEquals(action[0], action[3], 1e-12);
        assertEquals(0.6, Arrays.stream(action).sum(), 1e-12);
    }

    @Test
    void uniformUsesWholeBudgetAndNoneSpendsNothing() {
        List<RegionPolicy> regions = List.of(region("A", 2), region("B", 5));

        assertEquals(1.0, Arrays.stream(BuiltInPolicy.UNIFORM.allocate(0, regions)).sum(), 1e-12);
        assertEquals(0.0, Arrays.stream(BuiltInPolicy.NONE.allocate(0, regions)).sum());
    }

    @Test
    void namesResolveCaseInsensitively() {
        assertEquals(BuiltInPolicy.STATUS_QUO, BuiltInPolicy.fromName("status_quo"));
        assertEquals(BuiltInPolicy.NONE, BuiltInPolicy.fromName(" None "));
        assertThrows(IllegalArgumentException.class, () -> BuiltInPolicy.fromName("random"));
    }
}
