package io.github.kbadmin.access.security;

/** The authenticated user performing a mutation, as recorded in audit entries. */
public record Actor(String id, String email, String ipAddress) {}
