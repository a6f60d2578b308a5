package io.github.kbadmin.access.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.github.kbadmin.access.model.EntityType;
import io.github.kbadmin.access.model.PermissionLevel;
import io.github.kbadmin.access.model.ResourceDomain;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;

class MeteredPermissionStoreTest {

    @Test
    void records_timer_per_operation_and_domain() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        InMemoryPermissionStore delegate =
                new InMemoryPermissionStore()
                        .grant(EntityType.TEAM, "t1", "b1", PermissionLevel.UPLOAD);
        MeteredPermissionStore store =
                new MeteredPermissionStore(registry, ResourceDomain.BUCKET, delegate);

        assertEquals(PermissionLevel.NONE, store.get(EntityType.USER, "u1", "b1"));
        assertEquals(
                PermissionLevel.UPLOAD, store.maxLevel(EntityType.TEAM, List.of("t1"), "b1"));
        store.maxLevel(EntityType.TEAM, List.of("t2"), "b1");

        Timer get =
                registry.find(MeteredPermissionStore.METRIC_NAME)
                        .tags("domain", "bucket", "operation", "get")
                        .timer();
        Timer maxLevel =
                registry.find(MeteredPermissionStore.METRIC_NAME)
                        .tags("domain", "bucket", "operation", "maxLevel")
                        .timer();
        assertNotNull(get);
        assertNotNull(maxLevel);
        assertEquals(1, get.count());
        assertEquals(2, maxLevel.count());
    }

    @Test
    void propagates_delegate_failures() {
        PermissionStore delegate = mock(PermissionStore.class);
        when(delegate.listAll())
                .thenThrow(new PermissionStoreException("boom", new RuntimeException()));
        MeteredPermissionStore store =
                new MeteredPermissionStore(
                        new SimpleMeterRegistry(), ResourceDomain.PROMPT, delegate);

        assertThrows(PermissionStoreException.class, store::listAll);
    }
}
