package com.energy.anomaly.engine;

import com.energy.anomaly.model.ScoreResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Combines scorer outputs into one outlier decision per row.
 *
 * A single result passes through. Several results vote: the per-row flags
 * (-1 outlier / +1 inlier) are averaged and a row is an outlier only when the
 * mean is strictly negative, so a tie counts as normal.
 */
@Component
public class ScoreAggregator {

    /**
     * @return per-row decision, true = anomalous
     */
    public boolean[] aggregate(List<ScoreResult> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("At least one score result is required");
        }
        int n = results.get(0).size();
        for (ScoreResult result : results) {
            if (result.size() != n) {
                throw new IllegalArgumentException(String.format(
                        "Score results are not aligned: %s has %d rows, expected %d",
                        result.getScorerType(), result.size(), n));
            }
        }

        boolean[] decisions = new boolean[n];
        if (results.size() == 1) {
            ScoreResult only = results.get(0);
            for (int i = 0; i < n; i++) {
                decisions[i] = only.isOutlier(i);
            }
            return decisions;
        }

        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (ScoreResult result : results) {
                sum += result.getFlags()[i];
            }
            decisions[i] = sum / results.size() < 0.0;
        }
        return decisions;
    }
}
