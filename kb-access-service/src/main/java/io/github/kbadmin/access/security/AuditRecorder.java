package io.github.kbadmin.access.security;

public interface AuditRecorder {

    void log(AuditEntry entry);
}
