package com.energy.anomaly.engine.scaling;

import com.energy.anomaly.model.FeatureMatrix;

/**
 * Per-column affine scaling fitted once per run and shared by every scorer of that run.
 */
public interface Scaler {

    /**
     * Learn per-column center and scale from the matrix.
     */
    Scaler fit(FeatureMatrix matrix);

    /**
     * @return a new matrix with {@code (x - center) / scale} per column
     * @throws IllegalStateException if called before {@link #fit(FeatureMatrix)}
     */
    FeatureMatrix transform(FeatureMatrix matrix);

    default FeatureMatrix fitTransform(FeatureMatrix matrix) {
        return fit(matrix).transform(matrix);
    }
}
