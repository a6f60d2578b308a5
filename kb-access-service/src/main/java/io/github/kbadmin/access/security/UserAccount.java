package io.github.kbadmin.access.security;

import io.github.kbadmin.access.model.UserRole;

public record UserAccount(String id, String email, UserRole role) {

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isLeader() {
        return role == UserRole.LEADER;
    }
}
