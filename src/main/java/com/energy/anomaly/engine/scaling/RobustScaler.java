package com.energy.anomaly.engine.scaling;

import com.energy.anomaly.engine.Percentiles;

/**
 * Centers on the median and scales by the interquartile range, so a few extreme
 * readings do not compress the rest of the column.
 */
public class RobustScaler extends AbstractColumnScaler {

    @Override
    protected double center(double[] column) {
        return Percentiles.of(column, 50.0);
    }

    @Override
    protected double spread(double[] column) {
        return Percentiles.of(column, 75.0) - Percentiles.of(column, 25.0);
    }
}
