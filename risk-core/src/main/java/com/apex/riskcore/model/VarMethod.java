package com.apex.riskcore.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VarMethod {
    PARAMETRIC("parametric"),
    HISTORICAL("historical");

    private final String value;

    VarMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
