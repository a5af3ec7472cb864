package com.albatross.application.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TenantReadModel {

    /**
     * @return false when the tenant row already existed
     */
    boolean insert(TenantView tenant);

    Optional<TenantView> findById(String tenantId);

    List<TenantView> findAll();

    record TenantView(String tenantId, String name, Instant createdAt) {
    }
}
