package com.strata.platform.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * Kind of tenant. Natural persons are contracted for a limited number of days.
 */
public enum TenantType {
    COMPANY("company"),
    NATURAL_PERSON("natural_person");

    private final String value;

    TenantType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<TenantType> fromString(String value) {
        for (TenantType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static TenantType fromJson(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown client_type: " + value));
    }
}
