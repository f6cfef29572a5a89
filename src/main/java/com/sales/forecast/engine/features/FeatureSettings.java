package com.sales.forecast.engine.features;

import java.util.List;

/**
 * Derivation rules for the feature pipeline. Captured at training time and stored with the
 * artifacts so inference derives features with exactly the same rules.
 *
 * @param target            name of the target column, used to name derived features
 * @param lags              lag horizons in periods
 * @param rollingWindows    trailing window lengths in periods
 */
public record FeatureSettings(String target,
                              List<Integer> lags,
                              List<Integer> rollingWindows,
                              UnseenEntityPolicy unseenEntityPolicy,
                              AggregateFallback aggregateFallback) {

    public FeatureSettings {
        lags = List.copyOf(lags);
        rollingWindows = List.copyOf(rollingWindows);
        for (int lag : lags) {
            if (lag < 1) throw new IllegalArgumentException("Lag horizons must be >= 1, got " + lag);
        }
        for (int window : rollingWindows) {
            if (window < 1) throw new IllegalArgumentException("Rolling windows must be >= 1, got " + window);
        }
    }

    /**
     * Number of trailing periods per entity needed to compute every lag and rolling feature.
     */
    public int historyDepth() {
        int depth = 0;
        for (int lag : lags) depth = Math.max(depth, lag);
        for (int window : rollingWindows) depth = Math.max(depth, window);
        return depth;
    }
}
