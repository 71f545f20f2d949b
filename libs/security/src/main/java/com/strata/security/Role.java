package com.strata.security;

import java.util.Optional;

/**
 * The three platform roles. The set is closed: the policy switches over it exhaustively and no
 * free-form role strings exist anywhere in the platform.
 */
public enum Role {

    /** Platform operator. Has no tenant and global rights over every tenant. */
    ROOT("root"),

    /** Administrator of one tenant. */
    COMPANY_ADMIN("company_admin"),

    /** Regular member of one tenant. */
    USER("user");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** Wire and storage representation, e.g. {@code "company_admin"}. */
    public String value() {
        return value;
    }

    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
