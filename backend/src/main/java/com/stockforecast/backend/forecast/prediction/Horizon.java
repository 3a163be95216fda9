package com.stockforecast.backend.forecast.prediction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Horizon tag stamped on a prediction. The artifact decides what one step ahead means;
 * the tag is carried through for the caller.
 */
public enum Horizon {
    ONE_DAY("1d"),
    FIVE_DAYS("5d"),
    TEN_DAYS("10d"),
    THIRTY_DAYS("30d");

    public static final Horizon DEFAULT = TEN_DAYS;

    private final String tag;

    Horizon(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static Horizon fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return DEFAULT;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(horizon -> horizon.tag.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported horizon: " + tag + " (expected 1d, 5d, 10d or 30d)"));
    }
}
