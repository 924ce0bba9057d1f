package com.wardroute.router.model;

import java.util.Locale;
import java.util.Set;

public enum VehicleStatus {
    ACTIVE,
    INACTIVE,
    UNKNOWN;

    private static final Set<String> ACTIVE_LABELS = Set.of("ACTIVE", "AVAILABLE", "ONLINE");
    private static final Set<String> INACTIVE_LABELS = Set.of("INACTIVE", "OFFLINE", "UNAVAILABLE", "MAINTENANCE");

    public static VehicleStatus fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        if (ACTIVE_LABELS.contains(normalized)) {
            return ACTIVE;
        }
        if (INACTIVE_LABELS.contains(normalized)) {
            return INACTIVE;
        }
        return UNKNOWN;
    }

    public boolean isActive() {
        return this == ACTIVE;
    }
}
