package com.streamfirst.zone.directory.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * How a channel override names the credentials to use against a peer zone. Exactly one of three
 * shapes is configured; resolution against the credential store depends on the shape.
 */
public sealed interface CredentialReference
    permits CredentialReference.AccessKeyOnly,
        CredentialReference.AccessKeyWithSecret,
        CredentialReference.UserIdentity {

  /** An access key id whose owning user must be looked up to obtain the secret. */
  record AccessKeyOnly(String accessKeyId) implements CredentialReference {
    public AccessKeyOnly {
      requireText(accessKeyId, "Access key id");
    }
  }

  /** A complete key pair supplied in configuration. */
  record AccessKeyWithSecret(String accessKeyId, String secret) implements CredentialReference {
    public AccessKeyWithSecret {
      requireText(accessKeyId, "Access key id");
      Objects.requireNonNull(secret, "Secret cannot be null");
    }

    public AccessKey toAccessKey() {
      return new AccessKey(accessKeyId, secret);
    }

    @Override
    public String toString() {
      return "AccessKeyWithSecret[accessKeyId=" + accessKeyId + ", secret=****]";
    }
  }

  /** A user whose stored access keys are used. */
  record UserIdentity(String uid) implements CredentialReference {
    public UserIdentity {
      requireText(uid, "User id");
    }
  }

  /**
   * Builds a reference from loosely configured optional fields. An access key id takes
   * precedence over a user id; a secret is only meaningful together with an access key id and is
   * ignored otherwise.
   *
   * @return the reference, or empty when neither an access key id nor a user id is set
   */
  static Optional<CredentialReference> of(
      Optional<String> uid, Optional<String> accessKeyId, Optional<String> secret) {
    if (accessKeyId.isPresent()) {
      if (secret.isPresent()) {
        return Optional.of(new AccessKeyWithSecret(accessKeyId.get(), secret.get()));
      }
      return Optional.of(new AccessKeyOnly(accessKeyId.get()));
    }
    return uid.map(UserIdentity::new);
  }

  private static void requireText(String value, String what) {
    Objects.requireNonNull(value, what + " cannot be null");
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException(what + " cannot be empty");
    }
  }
}
