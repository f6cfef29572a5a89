package com.sales.forecast.engine.features;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sales.forecast.exception.UnseenEntityException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Bidirectional mapping between identifier values and dense zero-based codes.
 *
 * Codes follow the natural string order of the distinct values seen at fit time, so the same
 * vocabulary always yields the same codes whatever the input row order. The mapping is never
 * modified after construction.
 */
public final class CategoricalEncoder {

    public static final int UNKNOWN_CODE = -1;

    private final String field;
    private final List<String> categories;
    private final Map<String, Integer> codes;

    @JsonCreator
    public CategoricalEncoder(@JsonProperty("field") String field,
                              @JsonProperty("categories") List<String> categories) {
        this.field = field;
        this.categories = List.copyOf(categories);
        Map<String, Integer> forward = new HashMap<>();
        for (int i = 0; i < this.categories.size(); i++) {
            if (forward.put(this.categories.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate category '" + this.categories.get(i) + "' for " + field);
            }
        }
        this.codes = Collections.unmodifiableMap(forward);
    }

    public static CategoricalEncoder fit(String field, Collection<String> values) {
        return new CategoricalEncoder(field, List.copyOf(new TreeSet<>(values)));
    }

    /**
     * @throws UnseenEntityException if the value is unknown and the policy is {@link UnseenEntityPolicy#FAIL}
     */
    public int encode(String value, UnseenEntityPolicy policy) {
        Integer code = codes.get(value);
        if (code != null) return code;
        if (policy == UnseenEntityPolicy.FAIL) {
            throw new UnseenEntityException(field, value);
        }
        return UNKNOWN_CODE;
    }

    public String decode(int code) {
        if (code < 0 || code >= categories.size()) {
            throw new IllegalArgumentException("Code " + code + " is not a known " + field + " code");
        }
        return categories.get(code);
    }

    public boolean contains(String value) {
        return codes.containsKey(value);
    }

    public int size() {
        return categories.size();
    }

    @JsonProperty("field")
    public String getField() {
        return field;
    }

    @JsonProperty("categories")
    public List<String> getCategories() {
        return categories;
    }
}
