package com.sales.forecast.engine.features;

/**
 * What encoding does with an agency or SKU that was not present at training time.
 */
public enum UnseenEntityPolicy {
    /** Raise {@link com.sales.forecast.exception.UnseenEntityException}. */
    FAIL,
    /** Encode as {@link CategoricalEncoder#UNKNOWN_CODE}. */
    SENTINEL
}
