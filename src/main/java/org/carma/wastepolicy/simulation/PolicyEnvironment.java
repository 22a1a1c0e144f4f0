package org.carma.wastepolicy.simulation;

import java.util.*;
import java.util.function.LongFunction;

/**
 * Episode wrapper for an external allocation controller.
 *
 * One episode is one term. Each controller action covers a whole quarter:
 * the vector is submitted to the ledger, which then runs until the next
 * quarter boundary.
 */
public class PolicyEnvironment {

    private final LongFunction<SimulationLedger> ledgerFactory;
    private SimulationLedger ledger;

    /**
     * @param ledgerFactory builds a fresh ledger for a given seed
     */
    public PolicyEnvironment(LongFunction<SimulationLedger> ledgerFactory) {
        this.ledgerFactory = Objects.requireNonNull(ledgerFactory, "Ledger factory cannot be null");
    }

    /**
     * Outcome of one controller action.
     */
    public record StepResult(
            double[] state,
            double reward,
            boolean terminated,
            Map<String, Object> info
    ) {
    }

    /**
     * Start a new episode.
     * @return the initial state vector
     */
    public double[] reset(long seed) {
        ledger = Objects.requireNonNull(ledgerFactory.apply(seed), "Ledger factory returned null");
        return ledger.getState();
    }

    /**
     * Apply an allocation for the next quarter and run it.
     *
     * @throws IllegalStateException before {@link #reset} or after the episode ended
     * @throws IllegalArgumentException for a malformed allocation vector
     */
    public StepResult step(double[] action) {
        if (ledger == null) {
            throw new IllegalStateException("Environment must be reset before stepping");
        }
        if (!ledger.isRunning()) {
            throw new IllegalStateException("Episode has terminated; call reset");
        }

        ledger.submitAllocation(action);
        ledger.runQuarter();

        double[] state = ledger.getState();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("step", ledger.getStep());
        info.put("quarter", ledger.getQuarter());
        info.put("cashBalance", ledger.getTreasury().getCashBalance());
        info.put("averageCompliance", ledger.getAverageCompliance());
        info.put("politicalCapital", ledger.getPoliticalCapital().getValue());

        return new StepResult(state, ledger.calculateReward(), !ledger.isRunning(),
            Collections.unmodifiableMap(info));
    }

    public int getActionSize() {
        requireLedger();
        return ledger.getRegions().size() * 3;
    }

    public int getObservationSize() {
        requireLedger();
        return ledger.getRegions().size() + 3;
    }

    /**
     * Ledger of the current episode, or null before the first reset.
     */
    public SimulationLedger getLedger() {
        return ledger;
    }

    private void requireLedger() {
        if (ledger == null) {
            throw new IllegalStateException("Environment must be reset first");
        }
    }
}
