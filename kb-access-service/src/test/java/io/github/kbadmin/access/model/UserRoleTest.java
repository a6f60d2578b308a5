package io.github.kbadmin.access.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class UserRoleTest {

    @Test
    void known_roles_map_case_insensitively() {
        assertEquals(UserRole.ADMIN, UserRole.fromString("admin"));
        assertEquals(UserRole.LEADER, UserRole.fromString(" Leader "));
        assertEquals(UserRole.USER, UserRole.fromString("user"));
    }

    @Test
    void other_roles_read_as_plain_users() {
        assertEquals(UserRole.USER, UserRole.fromString("manager"));
        assertEquals(UserRole.USER, UserRole.fromString(null));
    }
}
