package com.energy.anomaly.engine.scaling;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Zero mean, unit population standard deviation per column.
 */
public class StandardScaler extends AbstractColumnScaler {

    @Override
    protected double center(double[] column) {
        return new Mean().evaluate(column);
    }

    @Override
    protected double spread(double[] column) {
        return new StandardDeviation(false).evaluate(column);
    }
}
