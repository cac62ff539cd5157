package com.spreadsheet.drilldown.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AiStatus {
    SUCCESS,
    FAILED;

    @JsonCreator
    public static AiStatus fromValue(String value) {
        return AiStatus.valueOf(value.trim().toUpperCase());
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
