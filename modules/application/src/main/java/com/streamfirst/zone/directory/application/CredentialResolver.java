package com.streamfirst.zone.directory.application;

import com.streamfirst.zone.directory.domain.AccessKey;
import com.streamfirst.zone.directory.domain.CredentialReference;
import com.streamfirst.zone.directory.domain.CredentialReference.AccessKeyOnly;
import com.streamfirst.zone.directory.domain.CredentialReference.AccessKeyWithSecret;
import com.streamfirst.zone.directory.domain.CredentialReference.UserIdentity;
import com.streamfirst.zone.directory.domain.UserRecord;
import com.streamfirst.zone.directory.ports.CredentialLookupException;
import com.streamfirst.zone.directory.ports.CredentialStorePort;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns the credential reference configured for a peer into a concrete access key. Resolution
 * never fails hard: a missing user, an unreadable store or a user without keys all resolve to
 * empty, and {@link #resolveOrSystemKey} substitutes the local system key.
 */
@Slf4j
@RequiredArgsConstructor
public class CredentialResolver {

  private final CredentialStorePort credentialStore;

  /**
   * Resolves a credential reference.
   *
   * <p>A key with its secret is returned as is. An access key id alone is looked up to find its
   * owner, and a user identity is looked up directly; in both cases one of the user's keys is
   * returned. Which key is picked when the user owns several is unspecified.
   *
   * @param peerLabel name of the peer the key is for, used in log messages
   * @param reference the configured reference
   * @return the access key, or empty if it could not be resolved
   */
  public Optional<AccessKey> resolve(String peerLabel, CredentialReference reference) {
    if (reference instanceof AccessKeyWithSecret withSecret) {
      return Optional.of(withSecret.toAccessKey());
    }
    if (reference instanceof AccessKeyOnly keyOnly) {
      return firstKeyOf(
          peerLabel,
          "access key " + keyOnly.accessKeyId(),
          () -> credentialStore.userByAccessKeyId(keyOnly.accessKeyId()));
    }
    if (reference instanceof UserIdentity user) {
      return firstKeyOf(
          peerLabel, "uid " + user.uid(), () -> credentialStore.userByIdentity(user.uid()));
    }
    throw new IllegalStateException("Unhandled credential reference " + reference);
  }

  /**
   * Resolves loosely configured credential fields. See {@link CredentialReference#of} for how
   * the fields combine.
   *
   * @return the access key, or empty if nothing is configured or it could not be resolved
   */
  public Optional<AccessKey> resolve(
      String peerLabel, Optional<String> uid, Optional<String> accessKeyId, Optional<String> secret) {
    Optional<CredentialReference> reference = CredentialReference.of(uid, accessKeyId, secret);
    if (reference.isEmpty()) {
      log.debug("No credentials configured for connection to dest={}", peerLabel);
      return Optional.empty();
    }
    return resolve(peerLabel, reference.get());
  }

  /**
   * Resolves a reference, falling back to the system key when there is no reference or it cannot
   * be resolved.
   */
  public AccessKey resolveOrSystemKey(
      String peerLabel, Optional<CredentialReference> reference, AccessKey systemKey) {
    Optional<AccessKey> key = reference.flatMap(r -> resolve(peerLabel, r));
    if (key.isPresent()) {
      return key.get();
    }

    log.info("Using default access key for connection to zone {}", peerLabel);
    return systemKey;
  }

  private Optional<AccessKey> firstKeyOf(
      String peerLabel, String subject, Supplier<Optional<UserRecord>> lookup) {
    Optional<UserRecord> user;
    try {
      user = lookup.get();
    } catch (CredentialLookupException e) {
      log.error(
          "Could not find user info for connection to dest={} ({}, code={})",
          peerLabel,
          subject,
          e.getErrorCode(),
          e);
      return Optional.empty();
    }

    if (user.isEmpty()) {
      log.error("Could not find user info for connection to dest={} ({})", peerLabel, subject);
      return Optional.empty();
    }

    if (!user.get().hasAccessKeys()) {
      log.error(
          "User (uid={}) has no access keys for dest={}", user.get().userId(), peerLabel);
      return Optional.empty();
    }

    return user.get().anyAccessKey();
  }
}
