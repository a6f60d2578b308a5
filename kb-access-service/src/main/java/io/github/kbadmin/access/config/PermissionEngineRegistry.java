package io.github.kbadmin.access.config;

import io.github.kbadmin.access.model.PermissionLevel;
import io.github.kbadmin.access.model.ResourceDomain;
import io.github.kbadmin.access.persistence.repo.PermissionGrantRepository;
import io.github.kbadmin.access.persistence.repo.TeamMemberRepository;
import io.github.kbadmin.access.persistence.repo.UserRepository;
import io.github.kbadmin.access.security.AuditRecorder;
import io.github.kbadmin.access.security.LeaderGrantValidator;
import io.github.kbadmin.access.service.DomainSettings;
import io.github.kbadmin.access.service.PermissionEngine;
import io.github.kbadmin.access.store.MeteredPermissionStore;
import io.github.kbadmin.access.store.PermissionStore;
import io.github.kbadmin.access.store.impl.PostgresPermissionStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.EnumMap;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/** Builds one {@link PermissionEngine} per resource domain over the shared collaborators. */
@ApplicationScoped
public class PermissionEngineRegistry {

    private static final Logger LOG = Logger.getLogger(PermissionEngineRegistry.class);

    @ConfigProperty(name = "kb-access.domains.bucket.default-level", defaultValue = "NONE")
    String bucketDefaultLevel;

    @ConfigProperty(name = "kb-access.domains.storage.default-level", defaultValue = "NONE")
    String storageDefaultLevel;

    @ConfigProperty(name = "kb-access.domains.prompt.default-level", defaultValue = "VIEW")
    String promptDefaultLevel;

    @Inject PermissionGrantRepository grantRepository;

    @Inject UserRepository userRepository;

    @Inject TeamMemberRepository teamMemberRepository;

    @Inject AuditRecorder auditRecorder;

    @Inject MeterRegistry meterRegistry;

    private final Map<ResourceDomain, PermissionEngine> engines =
            new EnumMap<>(ResourceDomain.class);

    @PostConstruct
    void init() {
        LeaderGrantValidator grantValidator = new LeaderGrantValidator(userRepository);
        for (ResourceDomain domain : ResourceDomain.values()) {
            DomainSettings settings = new DomainSettings(domain, defaultLevel(domain));
            PermissionStore store =
                    new MeteredPermissionStore(
                            meterRegistry,
                            domain,
                            new PostgresPermissionStore(grantRepository, domain));
            engines.put(
                    domain,
                    new PermissionEngine(
                            settings,
                            store,
                            userRepository,
                            teamMemberRepository,
                            grantValidator,
                            auditRecorder));
            LOG.infof(
                    "Configured %s permissions (table=%s, default level=%s)",
                    domain.toValue(), domain.table(), settings.defaultLevel());
        }
    }

    public PermissionEngine forDomain(ResourceDomain domain) {
        PermissionEngine engine = engines.get(domain);
        if (engine == null) {
            throw new IllegalStateException("No permission engine for " + domain);
        }
        return engine;
    }

    private PermissionLevel defaultLevel(ResourceDomain domain) {
        String configured =
                switch (domain) {
                    case BUCKET -> bucketDefaultLevel;
                    case STORAGE -> storageDefaultLevel;
                    case PROMPT -> promptDefaultLevel;
                };
        try {
            return PermissionLevel.parse(configured);
        } catch (RuntimeException e) {
            throw new IllegalStateException(
                    "Unsupported kb-access.domains."
                            + domain.toValue()
                            + ".default-level: "
                            + configured,
                    e);
        }
    }
}
