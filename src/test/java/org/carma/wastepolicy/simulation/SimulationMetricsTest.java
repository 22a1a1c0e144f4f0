package org.carma.wastepolicy.simulation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationMetricsTest {

    private static StepObservation observation(long step, double compliance, double capital,
                                               double cash, double reward, int fines) {
        return new StepObservation(step, 0, compliance, 0.2, capital, cash, 0.5, reward, fines);
    }

    private static SimulationMetrics recordCompliance(double... values) {
        SimulationMetrics metrics = new SimulationMetrics();
        for (int i = 0; i < values.length; i++) {
            metrics.recordStep(observation(i + 1, values[i], 1.0, 100.0, 0.0, 0));
        }
        return metrics;
    }

    @Test
    void emptyMetricsReportNeutralValues() {
        SimulationMetrics metrics = new SimulationMetrics();

        assertEquals(0, metrics.getStepCount());
        assertEquals(0.0, metrics.getFinalCompliance());
        assertEquals(0.0, metrics.getComplianceStdDev());
        assertEquals(0.0, metrics.getComplianceTrend(3));
        assertFalse(metrics.hasConverged(3, 0.1));
    }

    @Test
    void aggregatesTrackEveryStep() {
        SimulationMetrics metrics = new SimulationMetrics();
        metrics.recordStep(observation(1, 0.2, 0.9, 500.0, 0.5, 1));
        metrics.recordStep(observation(2, 0.4, 0.7, 400.0, -0.25, 2));
        metrics.recordStep(observation(3, 0.6, 0.8, 300.0, 0.25, 0));

        assertEquals(3, metrics.getStepCount());
        assertEquals(0.2, metrics.getInitialCompliance());
        assertEquals(0.6, metrics.getFinalCompliance());
        assertEquals(0.4, metrics.getAverageCompliance(), 1e-12);
        assertEquals(Math.sqrt(0.08 / 3.0), metrics.getComplianceStdDev(), 1e-12);
        assertEquals(0.8, metrics.getFinalPoliticalCapital());
        assertEquals(0.7, metrics.getMinimumPoliticalCapital());
        assertEquals(300.0, metrics.getFinalCashBalance());
        assertEquals(0.5, metrics.getTotalReward(), 1e-12);
        assertEquals(3, metrics.getTotalFines());
    }

    @Test
    void trendIsSlopeOverTrailingWindow() {
        SimulationMetrics rising = recordCompliance(0.9, 0.1, 0.2, 0.3, 0.4);

        assertEquals(0.1, rising.getComplianceTrend(4), 1e-12);
        assertEquals(0.0, rising.getComplianceTrend(6));

        SimulationMetrics flat = recordCompliance(0.5, 0.5, 0.5);
        assertEquals(0.0, flat.getComplianceTrend(3), 1e-12);
    }

    @Test
    void convergenceUsesMaximumAbsoluteDeviation() {
        SimulationMetrics metrics = recordCompliance(0.1, 0.5, 0.5, 0.51, 0.49);

        assertTrue(metrics.hasConverged(4, 0.02));
        assertFalse(metrics.hasConverged(4, 0.005));
        assertFalse(metrics.hasConverged(5, 0.02));
        assertFalse(metrics.hasConverged(6, 1.0));
    }

    @Test
    void historiesAreDefensiveCopies() {
        SimulationMetrics metrics = recordCompliance(0.3, 0.4);

        metrics.getComplianceHistory().clear();

        assertEquals(2, metrics.getComplianceHistory().size());
        assertEquals(2, metrics.getCashHistory().size());
    }

    @Test
    void summaryNamesKeyFigures() {
        SimulationMetrics metrics = new SimulationMetrics();
        metrics.recordStep(observation(1, 0.25, 0.9, 1234.5, 0.1, 3));

        String summary = metrics.getSummary();

        assertTrue(summary.contains("1 steps"), summary);
        assertTrue(summary.contains("final=0.2500"), summary);
        assertTrue(summary.contains("Fines issued: 3"), summary);
        assertTrue(summary.contains("final=1234.50"), summary);
    }
}
