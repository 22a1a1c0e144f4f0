package org.carma.wastepolicy.model;

import org.carma.wastepolicy.space.GridPosition;
import org.carma.wastepolicy.space.SpatialIndex;

import java.util.Objects;
import java.util.Random;

/**
 * Generates the household population of a region and places it on the grid.
 *
 * For every household:
 * - Income tier drawn 50% low, 30% mid, 20% high
 * - Initial compliance flag drawn from the region's configured rate
 * - Attitude starts high for initially compliant households, low otherwise
 * - Perceived control ~ N(0.7, 0.1) clipped to [0.2, 1.0]
 * - Subjective norm starts neutral at 0.5
 * - Position ~ N(region center, spread) per axis, clipped to the grid
 *
 * All draws come from the generator passed in, so a seed fixes the population.
 */
public class PopulationGenerator {

    public static final double COMPLIANT_ATTITUDE = 0.66;
    public static final double NON_COMPLIANT_ATTITUDE = 0.30;
    public static final double CONTROL_MEAN = 0.7;
    public static final double CONTROL_STD_DEV = 0.1;
    public static final double CONTROL_FLOOR = 0.2;
    public static final double INITIAL_NORM = 0.5;

    private final Random random;
    private final SpatialIndex<SteppingAgent> space;
    private final BehaviorProfile profile;

    public PopulationGenerator(Random random, SpatialIndex<SteppingAgent> space, BehaviorProfile profile) {
        this.random = Objects.requireNonNull(random, "Random cannot be null");
        this.space = Objects.requireNonNull(space, "Space cannot be null");
        this.profile = Objects.requireNonNull(profile, "Behavior profile cannot be null");
    }

    /**
     * Create {@code count} households for the region, add them to it and place
     * them around its center.
     *
     * @param initialCompliance probability that a household starts compliant
     * @param spread standard deviation of the placement around the center, in cells
     */
    public void populate(RegionPolicy region, int count, double initialCompliance, double spread) {
        if (count < 0) {
            throw new IllegalArgumentException("Household count cannot be negative");
        }
        if (!(initialCompliance >= 0.0 && initialCompliance <= 1.0)) {
            throw new IllegalArgumentException(
                "Initial compliance must be in [0, 1], got " + initialCompliance);
        }
        if (!(spread >= 0.0) || Double.isInfinite(spread)) {
            throw new IllegalArgumentException("Spread must be >= 0, got " + spread);
        }

        int offset = region.getPopulation();
        for (int i = 0; i < count; i++) {
            IncomeTier tier = IncomeTier.sample(random);
            boolean compliant = random.nextDouble() < initialCompliance;
            double attitude = compliant ? COMPLIANT_ATTITUDE : NON_COMPLIANT_ATTITUDE;
            double control = Math.max(CONTROL_FLOOR,
                Math.min(1.0, CONTROL_MEAN + random.nextGaussian() * CONTROL_STD_DEV));

            Household household = new Household(
                String.format("%s-H%05d", region.getId(), offset + i + 1),
                region.getId(), tier, attitude, INITIAL_NORM, control, compliant, profile);
            region.addHousehold(household);
            space.place(household, samplePosition(region.getCenter(), spread));
        }
    }

    private GridPosition samplePosition(GridPosition center, double spread) {
        int x = clip((int) Math.round(center.x() + random.nextGaussian() * spread), space.getWidth());
        int y = clip((int) Math.round(center.y() + random.nextGaussian() * spread), space.getHeight());
        return new GridPosition(x, y);
    }

    private static int clip(int value, int size) {
        return Math.max(0, Math.min(size - 1, value));
    }
}
