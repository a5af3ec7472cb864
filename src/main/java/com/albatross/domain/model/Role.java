package com.albatross.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum Role {
    PLATFORM_ADMIN("PlatformAdmin"),
    TENANT_ADMIN("TenantAdmin"),
    PILOT("Pilot");

    private final String label;

    Role(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts the label ({@code PlatformAdmin}), the enum name ({@code PLATFORM_ADMIN})
     * and the prefixed form ({@code ROLE_PLATFORM_ADMIN}).
     */
    public static Optional<Role> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String candidate = value.trim();
        return Arrays.stream(values())
            .filter(role -> role.label.equals(candidate)
                || role.name().equals(candidate)
                || ("ROLE_" + role.name()).equals(candidate))
            .findFirst();
    }
}
