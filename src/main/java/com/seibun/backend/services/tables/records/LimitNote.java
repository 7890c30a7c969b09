package com.seibun.backend.services.tables.records;

import com.fasterxml.jackson.annotation.JsonValue;
import com.seibun.backend.services.tables.LimitMarkers;

public enum LimitNote {
    AGGREGATE_TOTAL(LimitMarkers.AGGREGATE_TOTAL),
    NONE("");

    private final String label;

    LimitNote(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isPresent() {
        return this != NONE;
    }
}
