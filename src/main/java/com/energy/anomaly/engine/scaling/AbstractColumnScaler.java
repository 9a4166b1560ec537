package com.energy.anomaly.engine.scaling;

import com.energy.anomaly.model.FeatureMatrix;

abstract class AbstractColumnScaler implements Scaler {

    private double[] centers;
    private double[] scales;

    protected abstract double center(double[] column);

    protected abstract double spread(double[] column);

    @Override
    public Scaler fit(FeatureMatrix matrix) {
        int k = matrix.featureCount();
        centers = new double[k];
        scales = new double[k];
        for (int j = 0; j < k; j++) {
            double[] column = matrix.column(j);
            centers[j] = center(column);
            double s = spread(column);
            // constant column: leave unscaled
            scales[j] = (s == 0.0 || !Double.isFinite(s)) ? 1.0 : s;
        }
        return this;
    }

    @Override
    public FeatureMatrix transform(FeatureMatrix matrix) {
        if (centers == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " used before fit");
        }
        double[][] data = matrix.toArray();
        for (double[] row : data) {
            for (int j = 0; j < row.length; j++) {
                row[j] = (row[j] - centers[j]) / scales[j];
            }
        }
        return matrix.withValues(data);
    }
}
