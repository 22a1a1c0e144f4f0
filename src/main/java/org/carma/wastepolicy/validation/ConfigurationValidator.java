package org.carma.wastepolicy.validation;

import org.carma.wastepolicy.config.ScenarioConfigLoader.*;
import org.carma.wastepolicy.mechanism.BuiltInPolicy;
import org.carma.wastepolicy.model.TargetingMode;

import java.util.*;

/**
 * Validation of scenario configurations at load time.
 *
 * Catching a bad calibration here keeps it from surfacing as a silent
 * distortion hundreds of steps into a run.
 *
 * Validates:
 * - Grid dimensions are positive and every region center lies on the grid
 * - Budget, calendar and political-capital parameters are in range
 * - Policy costs are positive
 * - Behavioural rates and probabilities lie in [0, 1]
 * - Region ids are present and unique, populations and rates in range
 */
public class ConfigurationValidator {

    private static final double EPSILON = 0.001;

    /**
     * Result of configuration validation.
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<ValidationError> errors;
        private final List<ValidationWarning> warnings;

        public ValidationResult(boolean valid, List<ValidationError> errors,
                               List<ValidationWarning> warnings) {
            this.valid = valid;
            this.errors = Collections.unmodifiableList(errors);
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public static ValidationResult success() {
            return new ValidationResult(true, Collections.emptyList(), Collections.emptyList());
        }

        public static ValidationResult success(List<ValidationWarning> warnings) {
            return new ValidationResult(true, Collections.emptyList(), warnings);
        }

        public static ValidationResult failure(List<ValidationError> errors,
                                               List<ValidationWarning> warnings) {
            return new ValidationResult(false, errors, warnings);
        }

        public boolean isValid() { return valid; }
        public List<ValidationError> getErrors() { return errors; }
        public List<ValidationWarning> getWarnings() { return warnings; }
        public boolean hasWarnings() { return !warnings.isEmpty(); }

        /**
         * True if any error names the given field.
         */
        public boolean hasErrorFor(String field) {
            return errors.stream().anyMatch(e -> e.getField().equals(field));
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(valid ? "VALID" : "INVALID");
            if (!errors.isEmpty()) {
                sb.append(" (").append(errors.size()).append(" errors)");
            }
            if (!warnings.isEmpty()) {
                sb.append(" (").append(warnings.size()).append(" warnings)");
            }
            return sb.toString();
        }

        public String toDetailedString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ValidationResult: ").append(valid ? "VALID" : "INVALID").append("\n");

            if (!errors.isEmpty()) {
                sb.append("Errors:\n");
                for (ValidationError error : errors) {
                    sb.append("  ✗ ").append(error).append("\n");
                }
            }

            if (!warnings.isEmpty()) {
                sb.append("Warnings:\n");
                for (ValidationWarning warning : warnings) {
                    sb.append("  ⚠ ").append(warning).append("\n");
                }
            }

            return sb.toString();
        }
    }

    public static class ValidationError {
        private final String category;
        private final String field;
        private final String message;
        private final String recommendation;

        public ValidationError(String category, String field, String message, String recommendation) {
            this.category = category;
            this.field = field;
            this.message = message;
            this.recommendation = recommendation;
        }

        public String getCategory() { return category; }
        public String getField() { return field; }
        public String getMessage() { return message; }
        public String getRecommendation() { return recommendation; }

        @Override
        public String toString() {
            return String.format("[%s] %s: %s (%s)", category, field, message, recommendation);
        }
    }

    public static class ValidationWarning {
        private final String category;
        private final String message;

        public ValidationWarning(String category, String message) {
            this.category = category;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s", category, message);
        }
    }

    // ========================================================================
    // SCENARIO VALIDATION
    // ========================================================================

    /**
     * Validate a complete scenario configuration.
     */
    public ValidationResult validateScenario(ScenarioConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        validateGrid(config.grid, errors);
        validateLedger(config.ledger, errors, warnings);
        validateCosts(config.costs, errors);
        validateBehavior(config.behavior, errors, warnings);
        validateRegions(config, errors, warnings);
        validateFunding(config, warnings);

        return errors.isEmpty()
            ? ValidationResult.success(warnings)
            : ValidationResult.failure(errors, warnings);
    }

    private void validateGrid(GridConfig grid, List<ValidationError> errors) {
        if (grid.width < 1 || grid.height < 1) {
            errors.add(new ValidationError("Grid", "grid",
                "Non-positive dimensions: " + grid.width + "x" + grid.height,
                "Grid width and height must be at least 1"));
        }
    }

    private void validateLedger(LedgerConfig ledger, List<ValidationError> errors,
                                List<ValidationWarning> warnings) {
        if (!(ledger.annualBudget >= 0.0) || Double.isInfinite(ledger.annualBudget)) {
            errors.add(new ValidationError("Ledger", "ledger.annualBudget",
                "Invalid budget: " + ledger.annualBudget,
                "Budget must be a finite value >= 0"));
        } else if (ledger.annualBudget == 0.0) {
            warnings.add(new ValidationWarning("Ledger",
                "Annual budget is zero; no policy lever can be funded"));
        }
        if (ledger.quarterLength < 1) {
            errors.add(new ValidationError("Ledger", "ledger.quarterLength",
                "Non-positive quarter length: " + ledger.quarterLength,
                "A quarter must last at least one step"));
        }
        if (ledger.maxQuarters < 1) {
            errors.add(new ValidationError("Ledger", "ledger.maxQuarters",
                "Non-positive term length: " + ledger.maxQuarters,
                "A term must last at least one quarter"));
        }
        requireUnit(errors, "Ledger", "ledger.initialPoliticalCapital", ledger.initialPoliticalCapital);
        requireUnit(errors, "Ledger", "ledger.erosionRate", ledger.erosionRate);
        requireUnit(errors, "Ledger", "ledger.recoveryRate", ledger.recoveryRate);

        if (ledger.recoveryRate > ledger.erosionRate) {
            warnings.add(new ValidationWarning("Ledger",
                "Recovery rate exceeds erosion rate; full enforcement barely affects political capital"));
        }

        try {
            BuiltInPolicy.fromName(ledger.defaultPolicy);
        } catch (IllegalArgumentException | NullPointerException e) {
            errors.add(new ValidationError("Ledger", "ledger.defaultPolicy",
                "Unknown policy: " + ledger.defaultPolicy,
                "Use one of " + Arrays.toString(BuiltInPolicy.values())));
        }
    }

    private void validateCosts(CostConfig costs, List<ValidationError> errors) {
        requirePositive(errors, "costs.educationCostPerHousehold", costs.educationCostPerHousehold);
        requirePositive(errors, "costs.enforcementSaturation", costs.enforcementSaturation);
        requirePositive(errors, "costs.unitCostPerQuarter", costs.unitCostPerQuarter);
        requirePositive(errors, "costs.fineNormalization", costs.fineNormalization);
        requirePositive(errors, "costs.incentiveNormalization", costs.incentiveNormalization);
        if (!(costs.fineAmount >= 0.0) || Double.isInfinite(costs.fineAmount)) {
            errors.add(new ValidationError("Costs", "costs.fineAmount",
                "Invalid fine: " + costs.fineAmount,
                "Fine must be a finite value >= 0"));
        }
    }

    private void validateBehavior(BehaviorConfig b, List<ValidationError> errors,
                                  List<ValidationWarning> warnings) {
        if (b.attitudeWeight < 0 || b.normWeight < 0 || b.controlWeight < 0) {
            errors.add(new ValidationError("Behavior", "behavior.weights",
                "Negative TPB weight",
                "Attitude, norm and control weights must be non-negative"));
        } else {
            double sum = b.attitudeWeight + b.normWeight + b.controlWeight;
            if (Math.abs(sum - 1.0) > EPSILON) {
                warnings.add(new ValidationWarning("Behavior",
                    "TPB weights sum to " + String.format("%.4f", sum)
                        + "; the compliance threshold is calibrated for a sum of 1.0"));
            }
        }

        requireUnit(errors, "Behavior", "behavior.attitudeDecayRate", b.attitudeDecayRate);
        requireUnit(errors, "Behavior", "behavior.educationBoost", b.educationBoost);
        requireUnit(errors, "Behavior", "behavior.reactanceThreshold", b.reactanceThreshold);
        requireUnit(errors, "Behavior", "behavior.reactancePenalty", b.reactancePenalty);
        requireUnit(errors, "Behavior", "behavior.normFloor", b.normFloor);
        requireUnit(errors, "Behavior", "behavior.complianceThreshold", b.complianceThreshold);
        requireUnit(errors, "Behavior", "behavior.thresholdRelief", b.thresholdRelief);
        requireUnit(errors, "Behavior", "behavior.fineAttitudePenalty", b.fineAttitudePenalty);
        requireUnit(errors, "Behavior", "behavior.redemptionProbability", b.redemptionProbability);

        if (!(b.normSmoothing > 0.0 && b.normSmoothing <= 1.0)) {
            errors.add(new ValidationError("Behavior", "behavior.normSmoothing",
                "Out of range: " + b.normSmoothing,
                "Smoothing weight must be in (0, 1]"));
        }
        if (b.normAmplification < 1.0) {
            errors.add(new ValidationError("Behavior", "behavior.normAmplification",
                "Below 1: " + b.normAmplification,
                "Amplification must be >= 1"));
        }
        if (b.normRadius < 1) {
            errors.add(new ValidationError("Behavior", "behavior.normRadius",
                "Non-positive radius: " + b.normRadius,
                "Neighbourhood radius must be at least 1"));
        }
        if (b.effortCost < 0 || b.noiseStdDev < 0 || b.fineUtilityPenalty < 0) {
            errors.add(new ValidationError("Behavior", "behavior.costs",
                "Negative effort cost, noise or fine penalty",
                "Effort cost, noise and fine utility penalty must be non-negative"));
        }
        if (b.thresholdRelief > b.complianceThreshold) {
            errors.add(new ValidationError("Behavior", "behavior.thresholdRelief",
                "Relief " + b.thresholdRelief + " exceeds threshold " + b.complianceThreshold,
                "Threshold relief cannot exceed the compliance threshold"));
        }

        try {
            TargetingMode.valueOf(b.targetingMode.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            errors.add(new ValidationError("Behavior", "behavior.targetingMode",
                "Unknown targeting mode: " + b.targetingMode,
                "Use one of " + Arrays.toString(TargetingMode.values())));
        }
        if (b.patrolRange < 1) {
            errors.add(new ValidationError("Behavior", "behavior.patrolRange",
                "Non-positive patrol range: " + b.patrolRange,
                "Patrol range must be at least 1"));
        }
        if (b.catchRadius < 0 || b.catchRadius > b.patrolRange) {
            errors.add(new ValidationError("Behavior", "behavior.catchRadius",
                "Out of range: " + b.catchRadius,
                "Catch radius must be in [0, patrolRange]"));
        }
        if (b.noiseStdDev > 0.5) {
            warnings.add(new ValidationWarning("Behavior",
                "Noise std dev " + b.noiseStdDev + " dominates the TPB terms"));
        }
    }

    private void validateRegions(ScenarioConfig config, List<ValidationError> errors,
                                 List<ValidationWarning> warnings) {
        if (config.regions == null || config.regions.isEmpty()) {
            errors.add(new ValidationError("Regions", "regions",
                "No regions defined",
                "Define at least one region"));
            return;
        }

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < config.regions.size(); i++) {
            RegionConfig r = config.regions.get(i);
            String field = "regions[" + i + "]";

            if (r.id == null || r.id.isBlank()) {
                errors.add(new ValidationError("Regions", field + ".id",
                    "Missing region id",
                    "Every region needs a unique id"));
            } else if (!ids.add(r.id)) {
                errors.add(new ValidationError("Regions", field + ".id",
                    "Duplicate region id: " + r.id,
                    "Region ids must be unique"));
            }
            if (r.households < 0) {
                errors.add(new ValidationError("Regions", field + ".households",
                    "Negative population: " + r.households,
                    "Household count must be >= 0"));
            } else if (r.households == 0) {
                warnings.add(new ValidationWarning("Regions",
                    "Region " + r.id + " has no households; its compliance is reported as 0.0"));
            }
            requireUnit(errors, "Regions", field + ".initialCompliance", r.initialCompliance);
            if (!(r.spread >= 0.0) || Double.isInfinite(r.spread)) {
                errors.add(new ValidationError("Regions", field + ".spread",
                    "Invalid spread: " + r.spread,
                    "Spread must be a finite value >= 0"));
            }
            if (r.centerX < 0 || r.centerX >= config.grid.width
                    || r.centerY < 0 || r.centerY >= config.grid.height) {
                errors.add(new ValidationError("Regions", field + ".center",
                    "Center (" + r.centerX + "," + r.centerY + ") lies outside the "
                        + config.grid.width + "x" + config.grid.height + " grid",
                    "Move the center onto the grid"));
            }
        }
    }

    private void validateFunding(ScenarioConfig config, List<ValidationWarning> warnings) {
        double quarterly = config.ledger.annualBudget / 4.0;
        if (quarterly > 0 && config.costs.unitCostPerQuarter > 0
                && quarterly < config.costs.unitCostPerQuarter) {
            warnings.add(new ValidationWarning("Funding",
                "Quarterly budget " + String.format("%.0f", quarterly)
                    + " cannot fund a single enforcement unit"));
        }
        int households = config.regions == null ? 0 : config.getTotalHouseholds();
        if (households > config.grid.width * config.grid.height * 4) {
            warnings.add(new ValidationWarning("Grid",
                households + " households on a " + config.grid.width + "x" + config.grid.height
                    + " grid; neighbourhoods will be very dense"));
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void requireUnit(List<ValidationError> errors, String category, String field, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            errors.add(new ValidationError(category, field,
                "Out of range: " + value,
                "Value must be in [0, 1]"));
        }
    }

    private void requirePositive(List<ValidationError> errors, String field, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            errors.add(new ValidationError("Costs", field,
                "Non-positive value: " + value,
                "Value must be a finite value > 0"));
        }
    }
}
