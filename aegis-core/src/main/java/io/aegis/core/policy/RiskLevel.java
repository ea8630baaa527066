package io.aegis.core.policy;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RiskLevel fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("risk level must not be blank");
        }
        return RiskLevel.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
