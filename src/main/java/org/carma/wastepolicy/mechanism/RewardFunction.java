package org.carma.wastepolicy.mechanism;

/**
 * Scalar reward for the external controller.
 *
 * <pre>
 *   reward = wC · avgCompliance
 *          − wB · |remainingBudget − idealRemaining|
 *          − backlashPenalty   if avgEnforcement &gt; 0.7 and avgCompliance &lt; 0.3
 *   idealRemaining = 1 − elapsedFraction   (linear burn-down)
 * </pre>
 *
 * Pure: depends only on its arguments.
 */
public class RewardFunction {

    public static final double BACKLASH_ENFORCEMENT = 0.7;
    public static final double BACKLASH_COMPLIANCE = 0.3;

    private final double complianceWeight;
    private final double budgetDeviationWeight;
    private final double backlashPenalty;

    public RewardFunction() {
        this(1.0, 0.5, 1.0);
    }

    public RewardFunction(double complianceWeight, double budgetDeviationWeight, double backlashPenalty) {
        if (complianceWeight < 0 || budgetDeviationWeight < 0 || backlashPenalty < 0) {
            throw new IllegalArgumentException("Reward weights cannot be negative");
        }
        this.complianceWeight = complianceWeight;
        this.budgetDeviationWeight = budgetDeviationWeight;
        this.backlashPenalty = backlashPenalty;
    }

    /**
     * @param averageCompliance mean regional compliance rate
     * @param remainingBudgetFraction cash left as a fraction of the term budget
     * @param elapsedFraction steps taken as a fraction of the term
     * @param averageEnforcementIntensity mean regional enforcement intensity
     */
    public double calculate(double averageCompliance, double remainingBudgetFraction,
                            double elapsedFraction, double averageEnforcementIntensity) {
        double idealRemaining = 1.0 - Math.max(0.0, Math.min(1.0, elapsedFraction));
        double deviation = Math.abs(remainingBudgetFraction - idealRemaining);

        double reward = complianceWeight * averageCompliance - budgetDeviationWeight * deviation;
        if (isBacklash(averageCompliance, averageEnforcementIntensity)) {
            reward -= backlashPenalty;
        }
        return reward;
    }

    public static boolean isBacklash(double averageCompliance, double averageEnforcementIntensity) {
        return averageEnforcementIntensity > BACKLASH_ENFORCEMENT && averageCompliance < BACKLASH_COMPLIANCE;
    }

    public double getComplianceWeight() { return complianceWeight; }
    public double getBudgetDeviationWeight() { return budgetDeviationWeight; }
    public double getBacklashPenalty() { return backlashPenalty; }
}
