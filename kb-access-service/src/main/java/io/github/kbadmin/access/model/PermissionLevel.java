package io.github.kbadmin.access.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.github.kbadmin.access.store.InvalidRequestException;

/** Ordered access tier shared by every resource domain. */
public enum PermissionLevel {
    NONE(0),
    VIEW(1),
    UPLOAD(2),
    FULL(3);

    private final int value;

    PermissionLevel(int value) {
        this.value = value;
    }

    @JsonValue
    public int value() {
        return value;
    }

    public boolean isAtLeast(PermissionLevel required) {
        return value >= required.value;
    }

    public static PermissionLevel max(PermissionLevel a, PermissionLevel b) {
        return a.value >= b.value ? a : b;
    }

    public static PermissionLevel fromValue(int value) {
        for (PermissionLevel level : values()) {
            if (level.value == value) {
                return level;
            }
        }
        throw new InvalidRequestException("Unknown permission level: " + value);
    }

    /**
     * Parses either the numeric form ({@code "2"}) or the level name ({@code "upload"}).
     *
     * @throws InvalidRequestException if the value is blank or not a recognized level
     */
    public static PermissionLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("Permission level is required");
        }
        String trimmed = value.trim();
        try {
            return fromValue(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            try {
                return PermissionLevel.valueOf(trimmed.toUpperCase());
            } catch (IllegalArgumentException ignored) {
                throw new InvalidRequestException("Unknown permission level: " + value);
            }
        }
    }
}
