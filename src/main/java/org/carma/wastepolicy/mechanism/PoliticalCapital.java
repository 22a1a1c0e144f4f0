package org.carma.wastepolicy.mechanism;

/**
 * Public tolerance for enforcement.
 *
 * Per step: capital ← clamp(capital − α·e + β·(1 − e), 0, 1), where e is the
 * average enforcement intensity across regions. Heavy enforcement erodes
 * capital; restraint slowly restores it.
 */
public class PoliticalCapital {

    private final double erosionRate;
    private final double recoveryRate;
    private double value;

    public PoliticalCapital(double initialValue, double erosionRate, double recoveryRate) {
        requireUnit("initialValue", initialValue);
        requireUnit("erosionRate", erosionRate);
        requireUnit("recoveryRate", recoveryRate);
        this.value = initialValue;
        this.erosionRate = erosionRate;
        this.recoveryRate = recoveryRate;
    }

    /**
     * Apply one step of erosion and recovery.
     * @return the updated capital
     */
    public double update(double averageEnforcementIntensity) {
        double e = Math.max(0.0, Math.min(1.0, averageEnforcementIntensity));
        value = Math.max(0.0, Math.min(1.0, value - erosionRate * e + recoveryRate * (1.0 - e)));
        return value;
    }

    public double getValue() {
        return value;
    }

    public double getErosionRate() {
        return erosionRate;
    }

    public double getRecoveryRate() {
        return recoveryRate;
    }

    private static void requireUnit(String name, double v) {
        if (!(v >= 0.0 && v <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got " + v);
        }
    }

    @Override
    public String toString() {
        return String.format("PoliticalCapital[%.4f, α=%.4f, β=%.4f]", value, erosionRate, recoveryRate);
    }
}
