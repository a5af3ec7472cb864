package com.albatross.application.port.out;

import com.albatross.domain.model.Role;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface UserReadModel {

    /**
     * @return false when the user row already existed
     */
    boolean insert(UserView user);

    int updatePasswordHash(String userId, String passwordHash);

    int updateLastLogin(String userId, Instant lastLoginAt);

    Optional<UserView> findById(String userId);

    Optional<UserView> findByUsername(String username);

    Optional<UserView> findByEmail(String email);

    List<UserView> findAll();

    List<UserView> findByTenant(String tenantId);

    long count();

    record UserView(
        String userId,
        String tenantId,
        String username,
        String email,
        Role role,
        String passwordHash,
        Instant createdAt,
        Instant lastLoginAt
    ) {
    }
}
