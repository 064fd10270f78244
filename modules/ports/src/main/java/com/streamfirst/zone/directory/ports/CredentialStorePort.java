package com.streamfirst.zone.directory.ports;

import com.streamfirst.zone.directory.domain.UserRecord;
import java.util.Optional;

/**
 * Port for the user and credential store. Looks up users together with their stored access keys.
 */
public interface CredentialStorePort {

  /**
   * Finds the user owning an access key.
   *
   * @param accessKeyId the access key id
   * @return the owning user, or empty if no user owns the key
   * @throws CredentialLookupException if the store cannot be read
   */
  Optional<UserRecord> userByAccessKeyId(String accessKeyId);

  /**
   * Finds a user by identity.
   *
   * @param uid the user id
   * @return the user, or empty if it does not exist
   * @throws CredentialLookupException if the store cannot be read
   */
  Optional<UserRecord> userByIdentity(String uid);
}
