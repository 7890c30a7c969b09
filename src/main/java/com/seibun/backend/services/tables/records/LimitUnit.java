package com.seibun.backend.services.tables.records;

import com.fasterxml.jackson.annotation.JsonValue;
import com.seibun.backend.services.tables.LimitMarkers;

public enum LimitUnit {
    WEIGHT(LimitMarkers.WEIGHT),
    INTERNATIONAL_UNIT(LimitMarkers.INTERNATIONAL_UNIT),
    NONE("");

    private final String label;

    LimitUnit(String label) {
        this.label = label;
    }

    /**
     * Text written to the spreadsheet and the JSON dump.
     */
    @JsonValue
    public String label() {
        return label;
    }

    public boolean isPresent() {
        return this != NONE;
    }
}
