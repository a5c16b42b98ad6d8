package com.componenttrace.core.model;

import java.util.Objects;

/**
 * Short and fully-qualified name of a host component type.
 * The full name is null when the host only reported a display name.
 */
public record ComponentType(String shortName, String fullName) {

    public static final ComponentType UNKNOWN = new ComponentType("Unknown", null);

    public ComponentType {
        Objects.requireNonNull(shortName, "shortName");
    }

    public static ComponentType of(Class<?> type) {
        return new ComponentType(type.getSimpleName().isEmpty() ? type.getName() : type.getSimpleName(),
            type.getName());
    }

    /** True when both names are known and equal, or when only short names are known and they match. */
    public boolean sameTypeAs(ComponentType other) {
        if (other == null) return false;
        if (fullName != null && other.fullName != null) return fullName.equals(other.fullName);
        return shortName.equals(other.shortName);
    }
}
