package com.automate.ScanOps.Models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScanObjective {
    QUICK,
    COMPREHENSIVE,
    STEALTH,
    AGGRESSIVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScanObjective fromWire(String value) {
        if (value == null || value.isBlank()) {
            return COMPREHENSIVE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
