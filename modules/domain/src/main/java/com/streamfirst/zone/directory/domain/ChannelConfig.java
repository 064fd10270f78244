package com.streamfirst.zone.directory.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-channel override of how a peer zone is reached. A zone may carry one override for its data
 * channel and one for its sync-index (sip) channel. An empty endpoint list means "use the zone's
 * default endpoints".
 *
 * @param endpoints endpoints for this channel, possibly empty
 * @param credentials credentials for this channel, if configured
 */
public record ChannelConfig(List<String> endpoints, Optional<CredentialReference> credentials) {
  public ChannelConfig {
    endpoints = List.copyOf(Objects.requireNonNull(endpoints, "Endpoints cannot be null"));
    Objects.requireNonNull(credentials, "Credentials cannot be null, use Optional.empty()");
  }

  /** An override that inherits everything from the zone. */
  public static ChannelConfig inherit() {
    return new ChannelConfig(List.of(), Optional.empty());
  }

  /** An override that only replaces the endpoint list. */
  public static ChannelConfig ofEndpoints(List<String> endpoints) {
    return new ChannelConfig(endpoints, Optional.empty());
  }

  /** An override that only replaces the credentials. */
  public static ChannelConfig ofCredentials(CredentialReference credentials) {
    return new ChannelConfig(List.of(), Optional.of(credentials));
  }

  public boolean hasEndpoints() {
    return !endpoints.isEmpty();
  }
}
