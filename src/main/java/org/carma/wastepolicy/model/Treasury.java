package org.carma.wastepolicy.model;

/**
 * Financial accounts of a run.
 *
 * Tracks:
 * - Cash balance (may go transiently negative)
 * - Cumulative fines collected and the not-yet-settled recent fines
 * - Cumulative incentives paid out to households
 * - Cumulative amortised education, enforcement and incentive spend
 *
 * Only the ledger's daily settlement and the explicit fine / incentive
 * mutators write here.
 */
public class Treasury {

    private final double initialBalance;
    private double cashBalance;
    private double finesCollected;
    private double recentFines;
    private double incentivesPaid;
    private double educationSpend;
    private double enforcementSpend;
    private double incentiveSpend;

    public Treasury(double initialBalance) {
        if (!(initialBalance >= 0.0) || Double.isInfinite(initialBalance)) {
            throw new IllegalArgumentException("Initial balance must be >= 0, got " + initialBalance);
        }
        this.initialBalance = initialBalance;
        this.cashBalance = initialBalance;
    }

    // ========================================================================
    // Mutators
    // ========================================================================

    /**
     * Record a fine paid by a household.
     */
    public void recordFine(double amount) {
        if (amount < 0) throw new IllegalArgumentException("Fine cannot be negative");
        finesCollected += amount;
        recentFines += amount;
    }

    /**
     * Record an incentive successfully paid from a region's pool.
     */
    public void recordIncentivePaid(double amount) {
        if (amount < 0) throw new IllegalArgumentException("Incentive cannot be negative");
        incentivesPaid += amount;
    }

    /**
     * Deduct one day of amortised quarterly spend, fold recent fines back into
     * the balance and reset the recent-fines accumulator.
     */
    public void settleDay(double education, double enforcement, double incentive) {
        educationSpend += education;
        enforcementSpend += enforcement;
        incentiveSpend += incentive;
        cashBalance -= education + enforcement + incentive;
        cashBalance += recentFines;
        recentFines = 0.0;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public double getInitialBalance() { return initialBalance; }
    public double getCashBalance() { return cashBalance; }
    public double getFinesCollected() { return finesCollected; }
    public double getRecentFines() { return recentFines; }
    public double getIncentivesPaid() { return incentivesPaid; }
    public double getEducationSpend() { return educationSpend; }
    public double getEnforcementSpend() { return enforcementSpend; }
    public double getIncentiveSpend() { return incentiveSpend; }

    /**
     * Remaining cash as a fraction of the initial balance, clamped to [0, 1].
     */
    public double getRemainingFraction() {
        if (initialBalance <= 0.0) return 0.0;
        return Math.max(0.0, Math.min(1.0, cashBalance / initialBalance));
    }

    @Override
    public String toString() {
        return String.format("Treasury[cash=%.2f, fines=%.2f, incentives=%.2f, spend=%.2f]",
            cashBalance, finesCollected, incentivesPaid,
            educationSpend + enforcementSpend + incentiveSpend);
    }
}
