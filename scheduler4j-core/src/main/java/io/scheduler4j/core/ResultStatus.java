package io.scheduler4j.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ResultStatus {
    SUCCESS,
    INFO,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
