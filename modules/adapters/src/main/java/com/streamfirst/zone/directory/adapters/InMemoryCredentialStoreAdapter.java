package com.streamfirst.zone.directory.adapters;

import com.streamfirst.zone.directory.domain.AccessKey;
import com.streamfirst.zone.directory.domain.UserRecord;
import com.streamfirst.zone.directory.ports.CredentialLookupException;
import com.streamfirst.zone.directory.ports.CredentialStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of CredentialStorePort for testing and development.
 * Can be switched into an unavailable state to simulate a store outage.
 */
@Slf4j
public class InMemoryCredentialStoreAdapter implements CredentialStorePort {

    // Users by user id
    private final Map<String, UserRecord> users = new ConcurrentHashMap<>();

    // Owning user id by access key id
    private final Map<String, String> ownerByAccessKey = new ConcurrentHashMap<>();

    // Error code returned while the store is unavailable, 0 when available
    private volatile int unavailableCode = 0;

    /**
     * Adds or replaces a user together with its access keys.
     *
     * @throws IllegalArgumentException if one of the keys is already owned by another user
     */
    public void putUser(UserRecord user) {
        for (AccessKey key : user.accessKeys().values()) {
            String owner = ownerByAccessKey.get(key.id());
            if (owner != null && !owner.equals(user.userId())) {
                throw new IllegalArgumentException(
                    "Access key " + key.id() + " already belongs to user " + owner);
            }
        }

        removeUser(user.userId());
        users.put(user.userId(), user);
        user.accessKeys().keySet().forEach(keyId -> ownerByAccessKey.put(keyId, user.userId()));

        log.info("Stored user {} with {} access keys", user.userId(), user.accessKeys().size());
    }

    public void removeUser(String userId) {
        UserRecord removed = users.remove(userId);
        if (removed != null) {
            removed.accessKeys().keySet().forEach(ownerByAccessKey::remove);
            log.info("Removed user {}", userId);
        }
    }

    /**
     * Makes every subsequent lookup fail with the given code until {@link #markAvailable()}.
     *
     * @param errorCode negative errno-style code
     */
    public void markUnavailable(int errorCode) {
        if (errorCode >= 0) {
            throw new IllegalArgumentException("Error code must be negative, got " + errorCode);
        }
        unavailableCode = errorCode;
        log.warn("Credential store marked unavailable (code {})", errorCode);
    }

    public void markAvailable() {
        unavailableCode = 0;
        log.info("Credential store marked available");
    }

    @Override
    public Optional<UserRecord> userByAccessKeyId(String accessKeyId) {
        checkAvailable("access key " + accessKeyId);

        String owner = ownerByAccessKey.get(accessKeyId);
        if (owner == null) {
            log.debug("No user owns access key {}", accessKeyId);
            return Optional.empty();
        }
        return Optional.ofNullable(users.get(owner));
    }

    @Override
    public Optional<UserRecord> userByIdentity(String uid) {
        checkAvailable("user " + uid);

        UserRecord user = users.get(uid);
        if (user == null) {
            log.debug("User {} not found", uid);
        }
        return Optional.ofNullable(user);
    }

    private void checkAvailable(String subject) {
        int code = unavailableCode;
        if (code != 0) {
            throw new CredentialLookupException("Credential store unavailable looking up " + subject, code);
        }
    }
}
