package org.carma.wastepolicy.model;

/**
 * How an enforcement unit picks the household it walks toward.
 */
public enum TargetingMode {
    /** Chase the nearest non-compliant household within patrol range, else random walk. */
    NEAREST_VIOLATOR,
    /** Visit every household of the region in nearest-unvisited order, then start over. */
    SYSTEMATIC_SWEEP
}
