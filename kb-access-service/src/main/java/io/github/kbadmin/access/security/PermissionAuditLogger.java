package io.github.kbadmin.access.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.kbadmin.access.persistence.repo.AuditLogRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Default {@link AuditRecorder}: writes a structured line on the permission audit log category
 * and, unless disabled, a row in {@code audit_logs}.
 */
@ApplicationScoped
public class PermissionAuditLogger implements AuditRecorder {

    private static final Logger AUDIT_LOG =
            Logger.getLogger("io.github.kbadmin.access.permission.audit");

    @ConfigProperty(name = "kb-access.audit.persist", defaultValue = "true")
    boolean persist;

    @Inject AuditLogRepository auditLogRepository;

    @Inject ObjectMapper objectMapper;

    @Override
    public void log(AuditEntry entry) {
        AUDIT_LOG.infof(
                "PERMISSION_CHANGE actor=%s action=%s type=%s target=%s details=%s ip=%s",
                entry.userId(),
                entry.action(),
                entry.resourceType(),
                entry.resourceId(),
                entry.details(),
                entry.ipAddress());
        if (!persist) {
            return;
        }
        auditLogRepository.insert(
                entry.userId(),
                entry.userEmail(),
                entry.action(),
                entry.resourceType(),
                entry.resourceId(),
                toJson(entry),
                entry.ipAddress());
    }

    private String toJson(AuditEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry.details());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Unable to serialize audit details for " + entry.resourceId(), e);
        }
    }
}
