package com.albatross.adapter.out.cache;

import com.albatross.application.port.out.CredentialStore;
import com.albatross.application.port.out.CredentialStoreException;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Role;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Tokens live under {@code auth:token:<token>} as {@code {"user_id","tenant_id","role"}};
 * {@code auth:keyid:<keyId>} points back at the token of a generated API key.
 */
@Repository
@ConditionalOnProperty(name = "app.credentials.type", havingValue = "redis", matchIfMissing = true)
public class RedisCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCredentialStore.class);
    private static final String TOKEN_KEY_PREFIX = "auth:token:";
    private static final String KEY_ID_PREFIX = "auth:keyid:";

    private final StringRedisTemplate redisTemplate;
    private final ValueOperations<String, String> valueOps;
    private final ObjectMapper objectMapper;

    public RedisCredentialStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.valueOps = redisTemplate.opsForValue();
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<AuthenticatedUser> resolve(String token) {
        String json;
        try {
            json = valueOps.get(TOKEN_KEY_PREFIX + token);
        } catch (DataAccessException e) {
            throw new CredentialStoreException("Failed to resolve token", e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            String userId = node.path("user_id").asText(null);
            Optional<Role> role = Role.parse(node.path("role").asText(null));
            if (userId == null || role.isEmpty()) {
                log.warn("Ignoring malformed credential entry");
                return Optional.empty();
            }
            JsonNode tenant = node.get("tenant_id");
            String tenantId = tenant == null || tenant.isNull() ? null : tenant.asText();
            return Optional.of(new AuthenticatedUser(userId, tenantId, role.get()));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable credential entry: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(String token, AuthenticatedUser identity, Duration ttl) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("user_id", identity.userId());
        node.put("tenant_id", identity.tenantId());
        node.put("role", identity.role().label());
        try {
            if (ttl != null) {
                valueOps.set(TOKEN_KEY_PREFIX + token, node.toString(), ttl);
            } else {
                valueOps.set(TOKEN_KEY_PREFIX + token, node.toString());
            }
        } catch (DataAccessException e) {
            throw new CredentialStoreException("Failed to store token", e);
        }
        log.debug("Stored credential: userId={}, ttl={}", identity.userId(), ttl);
    }

    @Override
    public void revoke(String token) {
        try {
            redisTemplate.delete(TOKEN_KEY_PREFIX + token);
        } catch (DataAccessException e) {
            throw new CredentialStoreException("Failed to revoke token", e);
        }
    }

    @Override
    public void indexKey(String keyId, String token) {
        try {
            valueOps.set(KEY_ID_PREFIX + keyId, token);
        } catch (DataAccessException e) {
            throw new CredentialStoreException("Failed to index key " + keyId, e);
        }
    }

    @Override
    public Optional<String> tokenForKey(String keyId) {
        try {
            return Optional.ofNullable(valueOps.get(KEY_ID_PREFIX + keyId));
        } catch (DataAccessException e) {
            throw new CredentialStoreException("Failed to look up key " + keyId, e);
        }
    }

    @Override
    public void removeKeyIndex(String keyId) {
        try {
            redisTemplate.delete(KEY_ID_PREFIX + keyId);
        } catch (DataAccessException e) {
            throw new CredentialStoreException("Failed to remove key index " + keyId, e);
        }
    }
}
