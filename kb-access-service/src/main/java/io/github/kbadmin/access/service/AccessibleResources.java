package io.github.kbadmin.access.service;

import java.util.Set;

/**
 * Resources a user may see listed. {@code unrestricted} is set for administrators, in which case
 * {@code resourceIds} is empty and every resource is visible.
 */
public record AccessibleResources(boolean unrestricted, Set<String> resourceIds) {

    public static AccessibleResources all() {
        return new AccessibleResources(true, Set.of());
    }
}
