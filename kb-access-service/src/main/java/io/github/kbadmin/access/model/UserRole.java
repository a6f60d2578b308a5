package io.github.kbadmin.access.model;

public enum UserRole {
    ADMIN,
    LEADER,
    USER;

    public String toValue() {
        return name().toLowerCase();
    }

    /** Unknown or missing roles are treated as the least privileged role. */
    public static UserRole fromString(String value) {
        if (value == null) {
            return USER;
        }
        return switch (value.trim().toLowerCase()) {
            case "admin" -> ADMIN;
            case "leader" -> LEADER;
            default -> USER;
        };
    }
}
