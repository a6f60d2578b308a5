package io.github.kbadmin.access.persistence.repo;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;

@ApplicationScoped
public class AuditLogRepository {

    @Inject EntityManager entityManager;

    /**
     * Audit rows are written in their own transaction so a failed audit insert can never roll
     * back the grant it describes.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public void insert(
            String userId,
            String userEmail,
            String action,
            String resourceType,
            String resourceId,
            String detailsJson,
            String ipAddress) {
        entityManager
                .createNativeQuery(
                        "INSERT INTO audit_logs (user_id, user_email, action, resource_type,"
                                + " resource_id, details, ip_address) VALUES (CAST(?1 AS TEXT),"
                                + " ?2, ?3, ?4, CAST(?5 AS TEXT), CAST(?6 AS JSONB), CAST(?7 AS"
                                + " TEXT))")
                .setParameter(1, userId)
                .setParameter(2, userEmail)
                .setParameter(3, action)
                .setParameter(4, resourceType)
                .setParameter(5, resourceId)
                .setParameter(6, detailsJson)
                .setParameter(7, ipAddress)
                .executeUpdate();
    }
}
