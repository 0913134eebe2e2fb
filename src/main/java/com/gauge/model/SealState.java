package com.gauge.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SealState {
    SEALED,
    UNSEALED;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
