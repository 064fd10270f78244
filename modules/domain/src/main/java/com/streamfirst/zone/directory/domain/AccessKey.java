package com.streamfirst.zone.directory.domain;

import java.util.Objects;

/**
 * S3-style credential pair used to sign requests sent to a peer zone.
 *
 * @param id the access key id
 * @param secret the secret key
 */
public record AccessKey(String id, String secret) {
  public AccessKey {
    Objects.requireNonNull(id, "Access key id cannot be null");
    Objects.requireNonNull(secret, "Secret cannot be null");
    if (id.trim().isEmpty()) {
      throw new IllegalArgumentException("Access key id cannot be empty");
    }
  }

  @Override
  public String toString() {
    return "AccessKey{id=" + id + ", secret=****}";
  }
}
