package com.xksgroup.streamarchiver.model.Job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MediaKind {
    AUDIO,
    VIDEO,
    UNKNOWN;

    @JsonCreator
    public static MediaKind fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String displayName() {
        String lower = toValue();
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
