package org.carma.wastepolicy.model;

import org.carma.wastepolicy.event.EventBus;
import org.carma.wastepolicy.space.SpatialIndex;

import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Everything an agent may read during one step, handed in by the ledger.
 *
 * Agents reach their region through {@link #region(String)} by id and the
 * shared accounts through {@link #getTreasury()}; they never hold those
 * objects themselves.
 */
public final class StepContext {

    private final long step;
    private final Random random;
    private final SpatialIndex<SteppingAgent> space;
    private final Map<String, RegionPolicy> regions;
    private final Treasury treasury;
    private final EventBus events;

    public StepContext(long step, Random random, SpatialIndex<SteppingAgent> space,
                       Map<String, RegionPolicy> regions, Treasury treasury, EventBus events) {
        this.step = step;
        this.random = Objects.requireNonNull(random, "Random cannot be null");
        this.space = Objects.requireNonNull(space, "Space cannot be null");
        this.regions = Objects.requireNonNull(regions, "Regions cannot be null");
        this.treasury = Objects.requireNonNull(treasury, "Treasury cannot be null");
        this.events = Objects.requireNonNull(events, "Event bus cannot be null");
    }

    public long getStep() {
        return step;
    }

    public Random getRandom() {
        return random;
    }

    public SpatialIndex<SteppingAgent> getSpace() {
        return space;
    }

    public Treasury getTreasury() {
        return treasury;
    }

    public EventBus getEvents() {
        return events;
    }

    /**
     * Look up a region by id.
     * @throws IllegalStateException if the id is unknown
     */
    public RegionPolicy region(String regionId) {
        RegionPolicy region = regions.get(regionId);
        if (region == null) {
            throw new IllegalStateException("Unknown region: " + regionId);
        }
        return region;
    }
}
