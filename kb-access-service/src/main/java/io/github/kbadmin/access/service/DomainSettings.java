package io.github.kbadmin.access.service;

import io.github.kbadmin.access.model.PermissionLevel;
import io.github.kbadmin.access.model.ResourceDomain;

/**
 * Per-domain engine parameters.
 *
 * @param defaultLevel level resolved for a non-admin with no applicable grants
 */
public record DomainSettings(ResourceDomain domain, PermissionLevel defaultLevel) {}
