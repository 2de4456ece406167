package com.purchasingpower.brain.core;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Tenant and project a request is allowed to see.
 *
 * @param tenantId  owning tenant, never blank
 * @param projectId project key the caller is working in
 */
public record TenantScope(String tenantId, String projectId) {

    public TenantScope {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(tenantId), "tenantId is required");
    }

    public static TenantScope of(String tenantId, String projectId) {
        return new TenantScope(tenantId, projectId);
    }
}
