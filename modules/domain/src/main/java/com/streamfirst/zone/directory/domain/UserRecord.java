package com.streamfirst.zone.directory.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A user of the credential store together with its access keys.
 *
 * @param userId the user identity
 * @param accessKeys keys owned by the user, by access key id
 */
public record UserRecord(String userId, Map<String, AccessKey> accessKeys) {
  public UserRecord {
    Objects.requireNonNull(userId, "User id cannot be null");
    accessKeys = Map.copyOf(Objects.requireNonNull(accessKeys, "Access keys cannot be null"));
  }

  public static UserRecord of(String userId, AccessKey... keys) {
    Map<String, AccessKey> byId = new LinkedHashMap<>();
    for (AccessKey key : keys) {
      byId.put(key.id(), key);
    }
    return new UserRecord(userId, byId);
  }

  /**
   * Returns one of the user's access keys. The key map has no meaningful order, so when the user
   * owns several keys the choice is arbitrary.
   */
  public Optional<AccessKey> anyAccessKey() {
    return accessKeys.values().stream().findFirst();
  }

  public boolean hasAccessKeys() {
    return !accessKeys.isEmpty();
  }
}
