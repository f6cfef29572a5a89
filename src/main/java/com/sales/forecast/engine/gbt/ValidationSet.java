package com.sales.forecast.engine.gbt;

public record ValidationSet(double[][] features, double[] targets) {

    public ValidationSet {
        if (features.length != targets.length) {
            throw new IllegalArgumentException("Validation rows and targets differ: "
                    + features.length + " vs " + targets.length);
        }
    }

    public boolean isEmpty() {
        return targets.length == 0;
    }
}
