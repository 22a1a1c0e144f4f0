package org.carma.wastepolicy.config;

import org.carma.wastepolicy.event.EventBus;
import org.carma.wastepolicy.mechanism.BuiltInPolicy;
import org.carma.wastepolicy.model.*;
import org.carma.wastepolicy.simulation.LedgerSettings;
import org.carma.wastepolicy.simulation.SimulationLedger;
import org.carma.wastepolicy.space.GridPosition;
import org.carma.wastepolicy.space.MultiGrid;
import org.carma.wastepolicy.validation.ConfigurationValidator;
import org.carma.wastepolicy.validation.ConfigurationValidator.ValidationResult;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.*;
import java.math.BigInteger;
import java.nio.file.*;
import java.util.*;
import java.util.function.LongFunction;

/**
 * Loads scenario configurations from YAML files.
 *
 * A scenario consists of:
 * - Grid dimensions and the random seed
 * - Ledger settings (budget, calendar, political capital, default policy)
 * - Policy costs
 * - Behavioural parameters shared by all agents
 * - Region definitions (population, initial compliance, placement)
 *
 * Directory structure:
 * <pre>
 * scenarios/
 *   bacolod/
 *     scenario.yaml
 * </pre>
 *
 * Every key is optional except the region list; missing keys take the
 * defaults of the corresponding builder.
 */
public class ScenarioConfigLoader {

    public static final String SCENARIO_FILE = "scenario.yaml";

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    /**
     * Root configuration for a scenario.
     */
    public static class ScenarioConfig {
        public String name;
        public String description;
        public long seed = 42;
        public GridConfig grid = new GridConfig();
        public LedgerConfig ledger = new LedgerConfig();
        public CostConfig costs = new CostConfig();
        public BehaviorConfig behavior = new BehaviorConfig();
        public List<RegionConfig> regions = new ArrayList<>();

        public int getTotalHouseholds() {
            return regions.stream().mapToInt(r -> r.households).sum();
        }

        @Override
        public String toString() {
            return String.format("ScenarioConfig[name=%s, regions=%d, households=%d]",
                name, regions.size(), getTotalHouseholds());
        }
    }

    public static class GridConfig {
        public int width = 50;
        public int height = 50;
    }

    public static class LedgerConfig {
        public double annualBudget = 20_000_000;
        public int quarterLength = 90;
        public int maxQuarters = 12;
        public double initialPoliticalCapital = 1.0;
        public double erosionRate = 0.003;
        public double recoveryRate = 0.001;
        public String defaultPolicy = "STATUS_QUO";
    }

    public static class CostConfig {
        public double educationCostPerHousehold = 650;
        public double enforcementSaturation = 375_000;
        public double unitCostPerQuarter = 45_000;
        public double fineAmount = 500;
        public double fineNormalization = 1000;
        public double incentiveNormalization = 1000;
    }

    /**
     * Behavioural parameters. Defaults mirror {@link BehaviorProfile#DEFAULT}.
     */
    public static class BehaviorConfig {
        public double attitudeWeight = 0.4;
        public double normWeight = 0.3;
        public double controlWeight = 0.3;
        public double attitudeDecayRate = 0.005;
        public double educationBoost = 0.02;
        public double reactanceThreshold = 0.8;
        public double reactancePenalty = 0.002;
        public int normRadius = 2;
        public double normSmoothing = 0.3;
        public boolean asymmetricNorms = true;
        public double normAmplification = 1.2;
        public double normFloor = 0.2;
        public double effortCost = 0.15;
        public double noiseStdDev = 0.05;
        public double complianceThreshold = 0.5;
        public double thresholdRelief = 0.05;
        public double fineUtilityPenalty = 0.5;
        public double fineAttitudePenalty = 0.01;
        public double redemptionProbability = 0.05;
        public String targetingMode = "NEAREST_VIOLATOR";
        public int patrolRange = 5;
        public int catchRadius = 1;
    }

    public static class RegionConfig {
        public String id;
        public String name;
        public int households;
        public double initialCompliance = 0.5;
        public int centerX;
        public int centerY;
        public double spread = 5.0;

        @Override
        public String toString() {
            return String.format("RegionConfig[id=%s, households=%d, compliance=%.2f]",
                id, households, initialCompliance);
        }
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;
    private final ConfigurationValidator validator;

    public ScenarioConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
        this.validator = new ConfigurationValidator();
    }

    /**
     * Load a scenario from a directory containing scenario.yaml.
     *
     * @throws IOException if the file is missing or unreadable
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public ScenarioConfig loadScenario(Path scenarioDir) throws IOException {
        Path scenarioFile = scenarioDir.resolve(SCENARIO_FILE);
        if (!Files.exists(scenarioFile)) {
            throw new IOException("scenario.yaml not found in: " + scenarioDir);
        }

        try (InputStream is = Files.newInputStream(scenarioFile)) {
            return parse(is);
        }
    }

    /**
     * Load a scenario bundled on the classpath, e.g. "scenarios/bacolod".
     */
    public ScenarioConfig loadFromClasspath(String scenarioPath) throws IOException {
        String resource = scenarioPath.endsWith("/")
            ? scenarioPath + SCENARIO_FILE
            : scenarioPath + "/" + SCENARIO_FILE;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("scenario.yaml not found on classpath: " + scenarioPath);
            }
            return parse(is);
        }
    }

    /**
     * Parse and validate a scenario document.
     */
    public ScenarioConfig parse(InputStream input) {
        return validated(parseScenarioConfig(asDocument(yaml.load(input))));
    }

    /**
     * Parse and validate a scenario given as a YAML string.
     */
    public ScenarioConfig parse(String document) {
        return validated(parseScenarioConfig(asDocument(yaml.load(document))));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asDocument(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Scenario document is empty");
        }
        if (!(raw instanceof Map)) {
            throw new IllegalArgumentException("Scenario document must be a mapping, got " + raw);
        }
        return (Map<String, Object>) raw;
    }

    private ScenarioConfig validated(ScenarioConfig config) {
        ValidationResult result = validator.validateScenario(config);
        if (!result.isValid()) {
            throw new IllegalArgumentException(
                "Invalid scenario '" + config.name + "':\n" + result.toDetailedString());
        }
        for (ConfigurationValidator.ValidationWarning warning : result.getWarnings()) {
            System.err.println("Scenario '" + config.name + "' warning: " + warning);
        }
        return config;
    }

    /**
     * Parse raw YAML into ScenarioConfig.
     */
    private ScenarioConfig parseScenarioConfig(Map<String, Object> raw) {
        ScenarioConfig config = new ScenarioConfig();

        config.name = getString(raw, "name", "unnamed");
        config.description = getString(raw, "description", "");
        config.seed = getLong(raw, "seed", 42L);

        Map<String, Object> gridMap = getSection(raw, "grid");
        if (gridMap != null) {
            config.grid.width = getInt(gridMap, "width", config.grid.width);
            config.grid.height = getInt(gridMap, "height", config.grid.height);
        }

        Map<String, Object> ledgerMap = getSection(raw, "ledger");
        if (ledgerMap != null) {
            LedgerConfig l = config.ledger;
            l.annualBudget = getDouble(ledgerMap, "annualBudget", l.annualBudget);
            l.quarterLength = getInt(ledgerMap, "quarterLength", l.quarterLength);
            l.maxQuarters = getInt(ledgerMap, "maxQuarters", l.maxQuarters);
            l.initialPoliticalCapital = getDouble(ledgerMap, "initialPoliticalCapital", l.initialPoliticalCapital);
            l.erosionRate = getDouble(ledgerMap, "erosionRate", l.erosionRate);
            l.recoveryRate = getDouble(ledgerMap, "recoveryRate", l.recoveryRate);
            l.defaultPolicy = getString(ledgerMap, "defaultPolicy", l.defaultPolicy);
        }

        Map<String, Object> costMap = getSection(raw, "costs");
        if (costMap != null) {
            CostConfig c = config.costs;
            c.educationCostPerHousehold = getDouble(costMap, "educationCostPerHousehold", c.educationCostPerHousehold);
            c.enforcementSaturation = getDouble(costMap, "enforcementSaturation", c.enforcementSaturation);
            c.unitCostPerQuarter = getDouble(costMap, "unitCostPerQuarter", c.unitCostPerQuarter);
            c.fineAmount = getDouble(costMap, "fineAmount", c.fineAmount);
            c.fineNormalization = getDouble(costMap, "fineNormalization", c.fineNormalization);
            c.incentiveNormalization = getDouble(costMap, "incentiveNormalization", c.incentiveNormalization);
        }

        Map<String, Object> behaviorMap = getSection(raw, "behavior");
        if (behaviorMap != null) {
            parseBehavior(behaviorMap, config.behavior);
        }

        Object regionList = raw.get("regions");
        if (regionList != null) {
            if (!(regionList instanceof List)) {
                throw new IllegalArgumentException("regions must be a list, got " + regionList);
            }
            List<?> entries = (List<?>) regionList;
            for (int i = 0; i < entries.size(); i++) {
                config.regions.add(parseRegion(asMapping("regions[" + i + "]", entries.get(i))));
            }
        }

        return config;
    }

    private void parseBehavior(Map<String, Object> m, BehaviorConfig b) {
        b.attitudeWeight = getDouble(m, "attitudeWeight", b.attitudeWeight);
        b.normWeight = getDouble(m, "normWeight", b.normWeight);
        b.controlWeight = getDouble(m, "controlWeight", b.controlWeight);
        b.attitudeDecayRate = getDouble(m, "attitudeDecayRate", b.attitudeDecayRate);
        b.educationBoost = getDouble(m, "educationBoost", b.educationBoost);
        b.reactanceThreshold = getDouble(m, "reactanceThreshold", b.reactanceThreshold);
        b.reactancePenalty = getDouble(m, "reactancePenalty", b.reactancePenalty);
        b.normRadius = getInt(m, "normRadius", b.normRadius);
        b.normSmoothing = getDouble(m, "normSmoothing", b.normSmoothing);
        b.asymmetricNorms = getBoolean(m, "asymmetricNorms", b.asymmetricNorms);
        b.normAmplification = getDouble(m, "normAmplification", b.normAmplification);
        b.normFloor = getDouble(m, "normFloor", b.normFloor);
        b.effortCost = getDouble(m, "effortCost", b.effortCost);
        b.noiseStdDev = getDouble(m, "noiseStdDev", b.noiseStdDev);
        b.complianceThreshold = getDouble(m, "complianceThreshold", b.complianceThreshold);
        b.thresholdRelief = getDouble(m, "thresholdRelief", b.thresholdRelief);
        b.fineUtilityPenalty = getDouble(m, "fineUtilityPenalty", b.fineUtilityPenalty);
        b.fineAttitudePenalty = getDouble(m, "fineAttitudePenalty", b.fineAttitudePenalty);
        b.redemptionProbability = getDouble(m, "redemptionProbability", b.redemptionProbability);
        b.targetingMode = getString(m, "targetingMode", b.targetingMode);
        b.patrolRange = getInt(m, "patrolRange", b.patrolRange);
        b.catchRadius = getInt(m, "catchRadius", b.catchRadius);
    }

    @SuppressWarnings("unchecked")
    private RegionConfig parseRegion(Map<String, Object> m) {
        RegionConfig r = new RegionConfig();
        r.id = getString(m, "id");
        r.name = getString(m, "name", r.id);
        r.households = getInt(m, "households", 0);
        r.initialCompliance = getDouble(m, "initialCompliance", r.initialCompliance);
        r.spread = getDouble(m, "spread", r.spread);

        Object center = m.get("center");
        if (center instanceof List) {
            List<Object> coords = (List<Object>) center;
            if (coords.size() != 2 || !(coords.get(0) instanceof Number) || !(coords.get(1) instanceof Number)) {
                throw new IllegalArgumentException("Region " + r.id + " center must be [x, y], got " + coords);
            }
            r.centerX = (int) wholeNumber("Region " + r.id + " center x", (Number) coords.get(0));
            r.centerY = (int) wholeNumber("Region " + r.id + " center y", (Number) coords.get(1));
        } else if (center != null) {
            throw new IllegalArgumentException("Region " + r.id + " center must be [x, y], got " + center);
        }
        return r;
    }

    // ========================================================================
    // BUILDING
    // ========================================================================

    /**
     * Build the behaviour profile.
     * @throws IllegalArgumentException for an out-of-range parameter
     */
    public BehaviorProfile buildBehaviorProfile(ScenarioConfig config) {
        BehaviorConfig b = config.behavior;
        return new BehaviorProfile.Builder()
            .attitudeWeight(b.attitudeWeight)
            .normWeight(b.normWeight)
            .controlWeight(b.controlWeight)
            .attitudeDecayRate(b.attitudeDecayRate)
            .educationBoost(b.educationBoost)
            .reactanceThreshold(b.reactanceThreshold)
            .reactancePenalty(b.reactancePenalty)
            .normRadius(b.normRadius)
            .normSmoothing(b.normSmoothing)
            .asymmetricNorms(b.asymmetricNorms)
            .normAmplification(b.normAmplification)
            .normFloor(b.normFloor)
            .effortCost(b.effortCost)
            .noiseStdDev(b.noiseStdDev)
            .complianceThreshold(b.complianceThreshold)
            .thresholdRelief(b.thresholdRelief)
            .fineUtilityPenalty(b.fineUtilityPenalty)
            .fineAttitudePenalty(b.fineAttitudePenalty)
            .redemptionProbability(b.redemptionProbability)
            .targetingMode(TargetingMode.valueOf(b.targetingMode.trim().toUpperCase()))
            .patrolRange(b.patrolRange)
            .catchRadius(b.catchRadius)
            .build();
    }

    public PolicyCosts buildPolicyCosts(ScenarioConfig config) {
        CostConfig c = config.costs;
        return new PolicyCosts.Builder()
            .educationCostPerHousehold(c.educationCostPerHousehold)
            .enforcementSaturation(c.enforcementSaturation)
            .unitCostPerQuarter(c.unitCostPerQuarter)
            .fineAmount(c.fineAmount)
            .fineNormalization(c.fineNormalization)
            .incentiveNormalization(c.incentiveNormalization)
            .build();
    }

    public LedgerSettings buildLedgerSettings(ScenarioConfig config) {
        LedgerConfig l = config.ledger;
        return new LedgerSettings.Builder()
            .annualBudget(l.annualBudget)
            .quarterLength(l.quarterLength)
            .maxQuarters(l.maxQuarters)
            .initialPoliticalCapital(l.initialPoliticalCapital)
            .erosionRate(l.erosionRate)
            .recoveryRate(l.recoveryRate)
            .defaultPolicy(BuiltInPolicy.fromName(l.defaultPolicy))
            .build();
    }

    /**
     * Build a ledger with the scenario's own seed.
     */
    public SimulationLedger buildLedger(ScenarioConfig config) {
        return buildLedger(config, config.seed, buildLedgerSettings(config), new EventBus(false));
    }

    /**
     * Build a ledger: grid, regions, population and accounts.
     *
     * One generator seeded with {@code seed} drives both population generation
     * and the run itself.
     */
    public SimulationLedger buildLedger(ScenarioConfig config, long seed,
                                        LedgerSettings settings, EventBus events) {
        Random random = new Random(seed);
        MultiGrid<SteppingAgent> grid = new MultiGrid<>(config.grid.width, config.grid.height);
        BehaviorProfile profile = buildBehaviorProfile(config);
        PolicyCosts costs = buildPolicyCosts(config);
        PopulationGenerator generator = new PopulationGenerator(random, grid, profile);

        List<RegionPolicy> regions = new ArrayList<>();
        for (RegionConfig rc : config.regions) {
            RegionPolicy region = new RegionPolicy(
                rc.id, rc.name, new GridPosition(rc.centerX, rc.centerY), costs, profile);
            generator.populate(region, rc.households, rc.initialCompliance, rc.spread);
            regions.add(region);
        }

        return new SimulationLedger(settings, regions, grid, random, events);
    }

    /**
     * Ledger factory for {@link org.carma.wastepolicy.simulation.PolicyEnvironment}:
     * each seed yields a fresh, fully populated ledger.
     */
    public LongFunction<SimulationLedger> ledgerFactory(ScenarioConfig config) {
        LedgerSettings settings = buildLedgerSettings(config);
        return seed -> buildLedger(config, seed, settings, new EventBus(false));
    }

    // ========================================================================
    // UTILITY METHODS
    // ========================================================================

    /**
     * List the scenario directories under a root directory.
     */
    public List<String> listScenarios(Path scenariosDir) throws IOException {
        if (!Files.exists(scenariosDir)) {
            return Collections.emptyList();
        }

        List<String> scenarios = new ArrayList<>();
        try (var stream = Files.list(scenariosDir)) {
            stream.filter(Files::isDirectory)
                  .filter(p -> Files.exists(p.resolve(SCENARIO_FILE)))
                  .map(p -> p.getFileName().toString())
                  .sorted()
                  .forEach(scenarios::add);
        }
        return scenarios;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private String getString(Map<String, Object> map, String key) {
        return getString(map, key, null);
    }

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private Map<String, Object> getSection(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? null : asMapping(key, value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMapping(String key, Object value) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(key + " must be a mapping, got " + value);
        }
        return (Map<String, Object>) value;
    }

    /**
     * Absent keys take the default; present keys must hold a number.
     * @throws IllegalArgumentException naming the key otherwise
     */
    private Number getNumber(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'");
        }
        return (Number) value;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        long value = getLong(map, key, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " is out of integer range: " + value);
        }
        return (int) value;
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue) {
        Number value = getNumber(map, key);
        return value == null ? defaultValue : wholeNumber(key, value);
    }

    private static long wholeNumber(String key, Number value) {
        if (value instanceof BigInteger) {
            throw new IllegalArgumentException(key + " is out of integer range: " + value);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException(key + " must be a whole number, got " + d);
            }
            return (long) d;
        }
        return value.longValue();
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Number value = getNumber(map, key);
        return value == null ? defaultValue : value.doubleValue();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
        }
        return (Boolean) value;
    }
}
