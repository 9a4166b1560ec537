package com.energy.anomaly.engine.scaling;

import com.energy.anomaly.model.ScalingMethod;

public final class Scalers {

    private Scalers() {}

    public static Scaler create(ScalingMethod method) {
        return switch (method) {
            case ROBUST -> new RobustScaler();
            case STANDARD -> new StandardScaler();
        };
    }
}
