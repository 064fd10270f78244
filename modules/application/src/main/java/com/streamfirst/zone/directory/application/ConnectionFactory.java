package com.streamfirst.zone.directory.application;

import com.streamfirst.zone.directory.domain.AccessKey;
import com.streamfirst.zone.directory.domain.ChannelConfig;
import com.streamfirst.zone.directory.domain.ZoneDescriptor;
import com.streamfirst.zone.directory.domain.ZoneGroup;
import com.streamfirst.zone.directory.domain.ZoneId;
import com.streamfirst.zone.directory.ports.ConnectionPort;
import com.streamfirst.zone.directory.ports.PeerConnection;
import com.streamfirst.zone.directory.ports.TopologyPort;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds connections to peer zones. Chooses the endpoint list and the credentials of a connection
 * and delegates construction to the {@link ConnectionPort}. Nothing is cached here; every call
 * returns a new connection owned by the caller.
 */
@Slf4j
@RequiredArgsConstructor
public class ConnectionFactory {

  private final TopologyPort topology;
  private final ConnectionPort connectionPort;
  private final CredentialResolver credentialResolver;

  /**
   * Returns the endpoints a zone is reached through unless a channel override says otherwise.
   * These are the zone's own endpoints, or the data-access override's endpoints if the zone
   * itself publishes none.
   */
  public static List<String> defaultEndpoints(ZoneDescriptor zone) {
    if (zone.endpoints().isEmpty()) {
      Optional<List<String>> dataEndpoints =
          zone.dataAccessConfig().filter(ChannelConfig::hasEndpoints).map(ChannelConfig::endpoints);
      if (dataEndpoints.isPresent()) {
        return dataEndpoints.get();
      }
    }
    return zone.endpoints();
  }

  /** Returns the API name of the zone group the zone is a member of, if known. */
  public Optional<String> apiNameFor(ZoneId zoneId) {
    return topology.zoneGroupOf(zoneId).flatMap(ZoneGroup::apiNameIfSet);
  }

  /**
   * Creates a connection for one channel of a zone.
   *
   * @param zone the peer zone
   * @param defaultEndpoints endpoints used when the override carries none
   * @param config the channel override
   * @param apiName API name of the zone's zone group
   * @return the connection, or empty if no endpoint is available
   */
  public Optional<PeerConnection> create(
      ZoneDescriptor zone,
      List<String> defaultEndpoints,
      ChannelConfig config,
      Optional<String> apiName) {
    List<String> endpoints = config.hasEndpoints() ? config.endpoints() : defaultEndpoints;
    if (endpoints.isEmpty()) {
      log.warn("Can't generate connection for zone {}: no endpoints defined", zone);
      return Optional.empty();
    }

    AccessKey accessKey =
        credentialResolver.resolveOrSystemKey(zone.name(), config.credentials(), systemKey());
    log.debug(
        "Connection for zone={} via {} using access_key={}", zone.name(), endpoints, accessKey.id());

    return Optional.of(construct(zone.id().value(), endpoints, accessKey, apiName));
  }

  /**
   * Creates a connection from the zone's own endpoints and the local system key, for zones
   * without a data-access override.
   *
   * @return the connection, or empty if the zone has no endpoints
   */
  public Optional<PeerConnection> createDefault(ZoneDescriptor zone, Optional<String> apiName) {
    if (zone.endpoints().isEmpty()) {
      log.warn("Can't generate connection for zone {}: no endpoints defined", zone);
      return Optional.empty();
    }
    return Optional.of(construct(zone.id().value(), zone.endpoints(), systemKey(), apiName));
  }

  /**
   * Creates a connection that is not backed by a zone record, such as one to an external
   * sync target.
   */
  public PeerConnection create(
      String remoteId, List<String> endpoints, AccessKey accessKey, Optional<String> apiName) {
    return construct(remoteId, endpoints, accessKey, apiName);
  }

  private PeerConnection construct(
      String remoteId, List<String> endpoints, AccessKey accessKey, Optional<String> apiName) {
    return connectionPort.construct(
        remoteId, endpoints, accessKey, topology.localZoneGroup().id(), apiName);
  }

  private AccessKey systemKey() {
    return topology.localZoneConfig().systemKey();
  }
}
