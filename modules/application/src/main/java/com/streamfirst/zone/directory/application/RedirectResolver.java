package com.streamfirst.zone.directory.application;

import com.streamfirst.zone.directory.domain.Result;
import com.streamfirst.zone.directory.domain.ZoneId;
import com.streamfirst.zone.directory.ports.TopologyPort;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the endpoint requests are redirected to when the local zone is configured to defer to a
 * redirect zone. An empty result means "do not redirect"; the caller decides whether that is an
 * error.
 */
@Slf4j
@RequiredArgsConstructor
public class RedirectResolver {

  private final TopologyPort topology;
  private final ConnectionDirectory directory;

  /**
   * Gets an endpoint of the redirect zone.
   *
   * @return the endpoint, or empty if no redirect zone is configured or it cannot be reached
   */
  public Optional<String> redirectEndpoint() {
    Optional<ZoneId> redirectZone = topology.localZoneConfig().redirectZoneId();
    if (redirectZone.isEmpty()) {
      return Optional.empty();
    }

    Optional<ConnectionPair> connections = directory.connectionsFor(redirectZone.get());
    if (connections.isEmpty()) {
      log.error("Cannot find entry for redirect zone: {}", redirectZone.get());
      return Optional.empty();
    }

    Result<String> endpoint = connections.get().data().reachableEndpoint();
    if (endpoint.isFailure()) {
      log.error(
          "Redirect zone {}: no reachable endpoint ({}, code={})",
          redirectZone.get(),
          endpoint.getErrorMessage().orElse("unknown"),
          endpoint.getErrorCode());
      return Optional.empty();
    }
    return endpoint.getValue();
  }
}
