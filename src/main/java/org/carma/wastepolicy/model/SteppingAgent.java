package org.carma.wastepolicy.model;

/**
 * Anything the ledger advances once per simulation step.
 */
public interface SteppingAgent {

    String getId();

    void step(StepContext context);
}
