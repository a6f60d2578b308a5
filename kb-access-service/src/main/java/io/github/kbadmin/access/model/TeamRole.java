package io.github.kbadmin.access.model;

public enum TeamRole {
    MEMBER,
    LEADER;

    public String toValue() {
        return name().toLowerCase();
    }
}
