package org.carma.wastepolicy.simulation;

/**
 * What the ledger saw at the end of one step.
 */
public record StepObservation(
        long step,
        int quarter,
        double averageCompliance,
        double averageEnforcementIntensity,
        double politicalCapital,
        double cashBalance,
        double remainingBudgetFraction,
        double reward,
        int finesIssued
) {
}
