package com.strata.platform.domain;

import java.util.Optional;

public enum AccountStatus {
    ACTIVE("active"),
    DISABLED("disabled");

    private final String value;

    AccountStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<AccountStatus> fromString(String value) {
        for (AccountStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
