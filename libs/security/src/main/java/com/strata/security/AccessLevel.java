package com.strata.security;

import java.util.Optional;

/**
 * Orthogonal to {@link Role}: gates write-capable actions such as uploads and training runs.
 */
public enum AccessLevel {

    READ_ONLY("read_only"),
    READ_WRITE("read_write");

    private final String value;

    AccessLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean canWrite() {
        return this == READ_WRITE;
    }

    public static Optional<AccessLevel> fromString(String value) {
        for (AccessLevel level : values()) {
            if (level.value.equals(value)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
