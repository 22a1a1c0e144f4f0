package org.carma.wastepolicy.simulation;

import java.util.*;

/**
 * Tracks per-step metrics over a run for analysing its trajectory.
 */
public class SimulationMetrics {

    private final List<Double> complianceHistory;
    private final List<Double> capitalHistory;
    private final List<Double> cashHistory;
    private final List<Double> rewardHistory;
    private final List<Integer> finesHistory;
    private final List<Long> timestampHistory;
    private final long startTimeMs;

    public SimulationMetrics() {
        this.complianceHistory = new ArrayList<>();
        this.capitalHistory = new ArrayList<>();
        this.cashHistory = new ArrayList<>();
        this.rewardHistory = new ArrayList<>();
        this.finesHistory = new ArrayList<>();
        this.timestampHistory = new ArrayList<>();
        this.startTimeMs = System.currentTimeMillis();
    }

    // ========================================================================
    // Recording
    // ========================================================================

    public void recordStep(StepObservation observation) {
        complianceHistory.add(observation.averageCompliance());
        capitalHistory.add(observation.politicalCapital());
        cashHistory.add(observation.cashBalance());
        rewardHistory.add(observation.reward());
        finesHistory.add(observation.finesIssued());
        timestampHistory.add(System.currentTimeMillis() - startTimeMs);
    }

    // ========================================================================
    // Analysis
    // ========================================================================

    public int getStepCount() {
        return complianceHistory.size();
    }

    public long getElapsedMs() {
        if (timestampHistory.isEmpty()) return 0;
        return timestampHistory.get(timestampHistory.size() - 1);
    }

    public double getAverageCompliance() {
        return complianceHistory.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    public double getComplianceStdDev() {
        double avg = getAverageCompliance();
        return Math.sqrt(complianceHistory.stream()
            .mapToDouble(c -> Math.pow(c - avg, 2))
            .average().orElse(0));
    }

    public double getInitialCompliance() {
        if (complianceHistory.isEmpty()) return 0;
        return complianceHistory.get(0);
    }

    public double getFinalCompliance() {
        if (complianceHistory.isEmpty()) return 0;
        return complianceHistory.get(complianceHistory.size() - 1);
    }

    public double getFinalPoliticalCapital() {
        if (capitalHistory.isEmpty()) return 0;
        return capitalHistory.get(capitalHistory.size() - 1);
    }

    public double getMinimumPoliticalCapital() {
        return capitalHistory.stream().mapToDouble(Double::doubleValue).min().orElse(0);
    }

    public double getFinalCashBalance() {
        if (cashHistory.isEmpty()) return 0;
        return cashHistory.get(cashHistory.size() - 1);
    }

    public double getTotalReward() {
        return rewardHistory.stream().mapToDouble(Double::doubleValue).sum();
    }

    public int getTotalFines() {
        return finesHistory.stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Check if compliance has settled (every point of the last N steps within
     * threshold of their mean, absolutely).
     */
    public boolean hasConverged(int windowSize, double threshold) {
        if (complianceHistory.size() < windowSize) return false;

        List<Double> window = complianceHistory.subList(
            complianceHistory.size() - windowSize, complianceHistory.size());

        double avg = window.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double maxDev = window.stream()
            .mapToDouble(c -> Math.abs(c - avg))
            .max().orElse(0);

        return maxDev < threshold;
    }

    /**
     * Compliance trend (slope of linear regression over last N points).
     */
    public double getComplianceTrend(int windowSize) {
        if (complianceHistory.size() < windowSize) return 0;

        List<Double> window = complianceHistory.subList(
            complianceHistory.size() - windowSize, complianceHistory.size());

        int n = window.size();
        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += window.get(i);
            sumXY += i * window.get(i);
            sumX2 += i * i;
        }

        double denom = n * sumX2 - sumX * sumX;
        if (Math.abs(denom) < 1e-10) return 0;
        return (n * sumXY - sumX * sumY) / denom;
    }

    // ========================================================================
    // History Access
    // ========================================================================

    public List<Double> getComplianceHistory() {
        return new ArrayList<>(complianceHistory);
    }

    public List<Double> getPoliticalCapitalHistory() {
        return new ArrayList<>(capitalHistory);
    }

    public List<Double> getCashHistory() {
        return new ArrayList<>(cashHistory);
    }

    public List<Double> getRewardHistory() {
        return new ArrayList<>(rewardHistory);
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Simulation Metrics Summary:\n");
        sb.append(String.format("  Duration: %.2f seconds (%d steps)\n",
            getElapsedMs() / 1000.0, getStepCount()));
        sb.append(String.format("  Compliance: initial=%.4f, final=%.4f, avg=%.4f, stddev=%.4f\n",
            getInitialCompliance(), getFinalCompliance(), getAverageCompliance(), getComplianceStdDev()));
        sb.append(String.format("  Political capital: final=%.4f, min=%.4f\n",
            getFinalPoliticalCapital(), getMinimumPoliticalCapital()));
        sb.append(String.format("  Cash balance: final=%.2f\n", getFinalCashBalance()));
        sb.append(String.format("  Fines issued: %d\n", getTotalFines()));
        sb.append(String.format("  Total reward: %.4f\n", getTotalReward()));
        sb.append(String.format("  Converged: %s\n", hasConverged(90, 0.02)));
        sb.append(String.format("  Trend (last 90): %.6f\n", getComplianceTrend(90)));
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("SimulationMetrics[%d steps, %.2fs, compliance=%.4f→%.4f]",
            getStepCount(), getElapsedMs() / 1000.0, getInitialCompliance(), getFinalCompliance());
    }
}
