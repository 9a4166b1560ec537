package com.energy.anomaly.engine;

import com.energy.anomaly.model.AnomalyRecord;
import com.energy.anomaly.model.Attribution;
import com.energy.anomaly.model.Feature;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.Observation;
import com.energy.anomaly.model.SeverityLevel;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;

/**
 * Joins a flagged observation with its severity and attribution into an output record.
 * Reported feature values come from the raw matrix, i.e. after missing-value imputation.
 */
@Component
public class ResultAssembler {

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public AnomalyRecord assemble(Observation observation, FeatureMatrix raw, int row,
                                  SeverityLevel severity, Attribution attribution) {
        return AnomalyRecord.builder()
                .date(observation.getTimestamp().format(DATE_FORMAT))
                .usageKwh(raw.value(row, Feature.USAGE))
                .co2Tco2(raw.value(row, Feature.EMISSIONS))
                .powerFactor(raw.value(row, Feature.POWER_FACTOR))
                .anomalyLabel(attribution.getAnomalyLabel())
                .diagnosis(attribution.getDiagnosis())
                .alertLevel(severity.getAlertLevel())
                .build();
    }
}
