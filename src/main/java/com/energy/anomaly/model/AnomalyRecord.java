package com.energy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One flagged reading in the analysis output, keyed for the dashboard export format.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"date", "Usage_kWh", "CO2(tCO2)", "Lagging_Current_Power_Factor",
        "Anomaly_Label", "FMEA_Diagnosis", "Alert_Level"})
public class AnomalyRecord {

    // yyyy-MM-dd HH:mm:ss
    @JsonProperty("date")
    private String date;

    @JsonProperty("Usage_kWh")
    private double usageKwh;

    @JsonProperty("CO2(tCO2)")
    private double co2Tco2;

    @JsonProperty("Lagging_Current_Power_Factor")
    private double powerFactor;

    @JsonProperty("Anomaly_Label")
    private String anomalyLabel;

    @JsonProperty("FMEA_Diagnosis")
    private String diagnosis;

    // 1 (minor) to 3 (critical)
    @JsonProperty("Alert_Level")
    private int alertLevel;
}
