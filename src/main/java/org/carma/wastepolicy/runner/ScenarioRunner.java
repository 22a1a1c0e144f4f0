package org.carma.wastepolicy.runner;

import org.carma.wastepolicy.config.ScenarioConfigLoader;
import org.carma.wastepolicy.config.ScenarioConfigLoader.*;
import org.carma.wastepolicy.event.Event;
import org.carma.wastepolicy.event.EventBus;
import org.carma.wastepolicy.mechanism.BuiltInPolicy;
import org.carma.wastepolicy.model.RegionPolicy;
import org.carma.wastepolicy.simulation.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Executes scenarios loaded from configuration files.
 *
 * Key features:
 * - Loads the scenario from a directory or from the bundled classpath copy
 * - Optionally overrides the term length, default policy and seed
 * - Runs the full term quarter by quarter under the default policy
 * - Reports the quarterly table and a metrics summary
 *
 * Usage:
 * <pre>
 * ScenarioRunner runner = new ScenarioRunner().quarters(4);
 * ScenarioResult result = runner.run(Paths.get("scenarios/bacolod"));
 * System.out.println(result);
 * </pre>
 */
public class ScenarioRunner {

    public static final String DEFAULT_SCENARIO = "scenarios/bacolod";

    private final ScenarioConfigLoader loader;

    private boolean verbose = true;
    private Integer quarters;
    private BuiltInPolicy policy;
    private Long seed;

    public ScenarioRunner() {
        this.loader = new ScenarioConfigLoader();
    }

    public ScenarioRunner verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    public ScenarioRunner quarters(int quarters) {
        if (quarters < 1) {
            throw new IllegalArgumentException("Quarters must be >= 1, got " + quarters);
        }
        this.quarters = quarters;
        return this;
    }

    public ScenarioRunner policy(BuiltInPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Policy cannot be null");
        return this;
    }

    public ScenarioRunner seed(long seed) {
        this.seed = seed;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Run a scenario from a directory.
     *
     * @param scenarioDir Directory containing scenario.yaml
     */
    public ScenarioResult run(Path scenarioDir) throws IOException {
        log("Loading scenario from: " + scenarioDir);
        return run(loader.loadScenario(scenarioDir));
    }

    /**
     * Run a scenario bundled on the classpath.
     */
    public ScenarioResult runFromClasspath(String scenarioPath) throws IOException {
        log("Loading scenario from classpath: " + scenarioPath);
        return run(loader.loadFromClasspath(scenarioPath));
    }

    /**
     * Run an already loaded scenario.
     */
    public ScenarioResult run(ScenarioConfig scenario) {
        log("Scenario: " + scenario.name);
        log("Description: " + scenario.description);
        log("");

        LedgerSettings.Builder settingsBuilder = loader.buildLedgerSettings(scenario).toBuilder();
        if (quarters != null) {
            settingsBuilder.maxQuarters(quarters);
        }
        if (policy != null) {
            settingsBuilder.defaultPolicy(policy);
        }
        LedgerSettings settings = settingsBuilder.build();
        long runSeed = seed != null ? seed : scenario.seed;

        EventBus events = new EventBus(false);
        if (verbose) {
            events.subscribe(Event.HeadcountChangedEvent.class, e ->
                log(String.format("  [step %d] %s enforcers: %d -> %d",
                    e.step(), e.regionId(), e.previousCount(), e.currentCount())));
        }

        SimulationLedger ledger = loader.buildLedger(scenario, runSeed, settings, events);

        log("Regions:");
        for (RegionPolicy region : ledger.getRegions()) {
            log(String.format("  %s (%s): %d households, initial compliance %.2f",
                region.getId(), region.getName(), region.getPopulation(), region.getLastComplianceRate()));
        }
        log(String.format("Quarterly budget: %.2f, quarters: %d, seed: %d, default policy: %s",
            settings.getQuarterlyBudget(), settings.getMaxQuarters(), runSeed, settings.getDefaultPolicy()));
        log("");

        log("=== SIMULATION ===");
        while (ledger.isRunning()) {
            StepObservation observation = ledger.runQuarter();
            log(String.format("Quarter %2d: compliance=%.4f, capital=%.4f, cash=%.2f, reward=%.4f",
                observation.quarter() + 1, observation.averageCompliance(), observation.politicalCapital(),
                observation.cashBalance(), observation.reward()));
        }
        log("");

        ScenarioResult result = new ScenarioResult(scenario.name, runSeed, ledger.getQuarterReports(),
            ledger.getMetrics(), ledger.getState(), ledger.getTotalFines(), ledger.getTreasury().getCashBalance());

        log("=== QUARTERLY REPORT ===");
        log(QuarterReport.toTable(result.quarterReports));
        log("=== SUMMARY ===");
        log(result.metrics.getSummary());

        return result;
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    /**
     * Complete result for a scenario run.
     */
    public static class ScenarioResult {
        public final String scenarioName;
        public final long seed;
        public final List<QuarterReport> quarterReports;
        public final SimulationMetrics metrics;
        public final double[] finalState;
        public final int totalFines;
        public final double finalCashBalance;

        public ScenarioResult(String scenarioName, long seed, List<QuarterReport> quarterReports,
                              SimulationMetrics metrics, double[] finalState,
                              int totalFines, double finalCashBalance) {
            this.scenarioName = scenarioName;
            this.seed = seed;
            this.quarterReports = List.copyOf(quarterReports);
            this.metrics = metrics;
            this.finalState = finalState.clone();
            this.totalFines = totalFines;
            this.finalCashBalance = finalCashBalance;
        }

        public double getFinalCompliance() {
            return metrics.getFinalCompliance();
        }

        /**
         * Report rows for one quarter (zero-based).
         */
        public List<QuarterReport> getQuarter(int quarter) {
            return quarterReports.stream()
                .filter(r -> r.quarter() == quarter)
                .collect(Collectors.toList());
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ScenarioResult[").append(scenarioName).append("]\n");
            sb.append("  Seed: ").append(seed).append("\n");
            sb.append("  Steps: ").append(metrics.getStepCount()).append("\n");
            sb.append("  Final compliance: ").append(String.format("%.4f", getFinalCompliance())).append("\n");
            sb.append("  Fines issued: ").append(totalFines).append("\n");
            sb.append("  Final cash: ").append(String.format("%.2f", finalCashBalance)).append("\n");
            return sb.toString();
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void log(String message) {
        if (verbose) {
            System.out.println(message);
        }
    }

    /**
     * List available scenarios.
     */
    public List<String> listScenarios(Path scenariosDir) throws IOException {
        return loader.listScenarios(scenariosDir);
    }

    // ========================================================================
    // Main Entry Point
    // ========================================================================

    public static void main(String[] args) {
        String scenarioDir = null;
        ScenarioRunner runner = new ScenarioRunner().verbose(false);

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--scenario", "-s" -> scenarioDir = args[++i];
                    case "--quarters", "-q" -> runner.quarters(Integer.parseInt(args[++i]));
                    case "--policy", "-p" -> runner.policy(BuiltInPolicy.fromName(args[++i]));
                    case "--seed" -> runner.seed(Long.parseLong(args[++i]));
                    case "--verbose", "-v" -> runner.verbose(true);
                    default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
        } catch (ArrayIndexOutOfBoundsException e) {
            System.err.println("Missing value for option " + args[args.length - 1]);
            printUsage();
            System.exit(2);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(2);
        }

        System.out.println("╔══════════════════════════════════════════════════════════════════╗");
        System.out.println("║         WASTE SEGREGATION POLICY SIMULATION                      ║");
        System.out.println("╚══════════════════════════════════════════════════════════════════╝");
        System.out.println();

        try {
            ScenarioResult result = scenarioDir != null
                ? runner.run(Paths.get(scenarioDir))
                : runner.runFromClasspath(DEFAULT_SCENARIO);

            if (!runner.verbose) {
                System.out.println(QuarterReport.toTable(result.quarterReports));
                System.out.println(result.metrics.getSummary());
            }
            System.out.print(result);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Scenario failed: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: ScenarioRunner [--scenario <dir>] [--quarters <n>] "
            + "[--policy NONE|UNIFORM|STATUS_QUO] [--seed <n>] [--verbose]");
    }
}
