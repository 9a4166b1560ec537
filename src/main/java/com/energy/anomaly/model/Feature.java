package com.energy.anomaly.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tracked measurements, in canonical column order. Every feature matrix,
 * score vector and attribution in a run uses this order.
 */
public enum Feature {

    USAGE("usage_kwh", "Usage_kWh", "Energy Consumption Anomaly"),
    EMISSIONS("co2_tco2", "CO2(tCO2)", "CO2 Emissions Anomaly"),
    POWER_FACTOR("power_factor", "Lagging_Current_Power_Factor", "Power Factor Anomaly");

    private final String columnName;
    private final String exportName;
    private final String anomalyLabel;

    Feature(String columnName, String exportName, String anomalyLabel) {
        this.columnName = columnName;
        this.exportName = exportName;
        this.anomalyLabel = anomalyLabel;
    }

    public String getColumnName() { return columnName; }

    public String getAnomalyLabel() { return anomalyLabel; }

    public static List<Feature> canonicalOrder() {
        return List.of(values());
    }

    /**
     * Resolve a CSV header to a feature. Accepts the input column name or the
     * export name used in the result file, case-insensitively.
     */
    public static Optional<Feature> fromHeader(String header) {
        if (header == null) return Optional.empty();
        String normalized = header.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.columnName.equals(normalized)
                        || f.exportName.toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
