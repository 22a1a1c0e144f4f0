package org.carma.wastepolicy.event;

/**
 * Base interface for all simulation events.
 * Events carry the simulation step instead of wall-clock time so that
 * an event trail from a seeded run is reproducible.
 */
public sealed interface Event permits
        Event.QuarterStartedEvent,
        Event.AllocationAppliedEvent,
        Event.HeadcountChangedEvent,
        Event.HouseholdFinedEvent,
        Event.IncentiveRedeemedEvent,
        Event.SimulationTickEvent {

    long step();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * A new quarter began and an allocation vector was applied.
     */
    record QuarterStartedEvent(
            long step,
            int quarter,
            double totalAllocated,
            double scaleFactor,
            boolean controllerSupplied
    ) implements Event {
        public String eventType() { return "QUARTER_STARTED"; }
    }

    /**
     * A region received its quarterly funds.
     */
    record AllocationAppliedEvent(
            long step,
            String regionId,
            double educationFund,
            double enforcementFund,
            double incentiveFund,
            double educationIntensity,
            double enforcementIntensity
    ) implements Event {
        public String eventType() { return "ALLOCATION_APPLIED"; }
    }

    /**
     * Enforcement units were hired or retired in a region.
     */
    record HeadcountChangedEvent(
            long step,
            String regionId,
            int previousCount,
            int currentCount
    ) implements Event {
        public String eventType() { return "HEADCOUNT_CHANGED"; }
    }

    /**
     * A non-compliant household was caught and fined.
     */
    record HouseholdFinedEvent(
            long step,
            String householdId,
            String regionId,
            double amount
    ) implements Event {
        public String eventType() { return "HOUSEHOLD_FINED"; }
    }

    /**
     * A compliant household claimed its incentive from the region pool.
     */
    record IncentiveRedeemedEvent(
            long step,
            String householdId,
            String regionId,
            double amount
    ) implements Event {
        public String eventType() { return "INCENTIVE_REDEEMED"; }
    }

    /**
     * End of a simulation step.
     */
    record SimulationTickEvent(
            long step,
            double averageCompliance,
            double politicalCapital,
            double cashBalance
    ) implements Event {
        public String eventType() { return "SIMULATION_TICK"; }
    }
}
