package org.carma.wastepolicy.simulation;

import java.util.List;
import java.util.Locale;

/**
 * One region's row of the end-of-quarter report.
 *
 * Allocation shares are percentages of the quarterly budget. The field
 * order of {@link #HEADER} and {@link #toRow()} is fixed. Text fields
 * containing the delimiter, a quote or a line break are double-quoted with
 * embedded quotes doubled.
 */
public record QuarterReport(
        int quarter,
        String regionId,
        String regionName,
        double educationPercent,
        double enforcementPercent,
        double incentivePercent,
        double complianceRate,
        int enforcementHeadcount
) {

    public static final String DELIMITER = ",";

    public static final String HEADER = String.join(DELIMITER,
        "quarter", "region_id", "region_name", "education_pct", "enforcement_pct",
        "incentive_pct", "compliance_rate", "enforcers");

    public String toRow() {
        return String.join(DELIMITER,
            Integer.toString(quarter),
            quote(regionId),
            quote(regionName),
            format(educationPercent),
            format(enforcementPercent),
            format(incentivePercent),
            String.format(Locale.ROOT, "%.4f", complianceRate),
            Integer.toString(enforcementHeadcount));
    }

    /**
     * Render rows under the header, one line per row.
     */
    public static String toTable(List<QuarterReport> reports) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        for (QuarterReport report : reports) {
            sb.append(report.toRow()).append('\n');
        }
        return sb.toString();
    }

    static String quote(String text) {
        if (text == null) return "";
        if (text.contains(DELIMITER) || text.indexOf('"') >= 0
                || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            return '"' + text.replace("\"", "\"\"") + '"';
        }
        return text;
    }

    private static String format(double percent) {
        return String.format(Locale.ROOT, "%.2f", percent);
    }
}
