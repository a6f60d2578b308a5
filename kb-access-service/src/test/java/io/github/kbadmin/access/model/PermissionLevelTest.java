package io.github.kbadmin.access.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.kbadmin.access.store.InvalidRequestException;
import org.junit.jupiter.api.Test;

class PermissionLevelTest {

    @Test
    void levels_are_totally_ordered() {
        assertTrue(PermissionLevel.FULL.isAtLeast(PermissionLevel.UPLOAD));
        assertTrue(PermissionLevel.UPLOAD.isAtLeast(PermissionLevel.VIEW));
        assertTrue(PermissionLevel.VIEW.isAtLeast(PermissionLevel.NONE));
        assertTrue(PermissionLevel.VIEW.isAtLeast(PermissionLevel.VIEW));
        assertFalse(PermissionLevel.VIEW.isAtLeast(PermissionLevel.UPLOAD));
        assertFalse(PermissionLevel.NONE.isAtLeast(PermissionLevel.VIEW));
    }

    @Test
    void max_picks_higher_level() {
        assertEquals(
                PermissionLevel.UPLOAD,
                PermissionLevel.max(PermissionLevel.VIEW, PermissionLevel.UPLOAD));
        assertEquals(
                PermissionLevel.FULL,
                PermissionLevel.max(PermissionLevel.FULL, PermissionLevel.NONE));
        assertEquals(
                PermissionLevel.NONE,
                PermissionLevel.max(PermissionLevel.NONE, PermissionLevel.NONE));
    }

    @Test
    void from_value_maps_persisted_integers() {
        assertEquals(PermissionLevel.NONE, PermissionLevel.fromValue(0));
        assertEquals(PermissionLevel.FULL, PermissionLevel.fromValue(3));
        assertThrows(InvalidRequestException.class, () -> PermissionLevel.fromValue(4));
        assertThrows(InvalidRequestException.class, () -> PermissionLevel.fromValue(-1));
    }

    @Test
    void parse_accepts_numbers_and_names() {
        assertEquals(PermissionLevel.UPLOAD, PermissionLevel.parse("2"));
        assertEquals(PermissionLevel.UPLOAD, PermissionLevel.parse("upload"));
        assertEquals(PermissionLevel.VIEW, PermissionLevel.parse(" View "));
    }

    @Test
    void parse_rejects_unknown_or_blank_values() {
        assertThrows(InvalidRequestException.class, () -> PermissionLevel.parse("admin"));
        assertThrows(InvalidRequestException.class, () -> PermissionLevel.parse("9"));
        assertThrows(InvalidRequestException.class, () -> PermissionLevel.parse(" "));
        assertThrows(InvalidRequestException.class, () -> PermissionLevel.parse(null));
    }

    @Test
    void serializes_as_integer() throws Exception {
        assertEquals("2", new ObjectMapper().writeValueAsString(PermissionLevel.UPLOAD));
    }
}
