package io.github.kbadmin.access.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.github.kbadmin.access.store.InvalidRequestException;

/** The principal a grant applies to. */
public enum EntityType {
    USER,
    TEAM;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    public static EntityType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("Entity type is required");
        }
        return switch (value.trim().toLowerCase()) {
            case "user" -> USER;
            case "team" -> TEAM;
            default -> throw new InvalidRequestException("Unknown entity type: " + value);
        };
    }
}
