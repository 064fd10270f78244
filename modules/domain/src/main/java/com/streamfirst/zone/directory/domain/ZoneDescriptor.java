package com.streamfirst.zone.directory.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A zone as published by the topology store. Read-only to the connection directory.
 *
 * @param id stable zone identifier
 * @param name human-readable zone name, unique within the realm
 * @param endpoints ordered default endpoints of the zone
 * @param dataAccessConfig override for the data channel, if any
 * @param sipConfig override for the sync-index channel, if any
 */
public record ZoneDescriptor(
    ZoneId id,
    String name,
    List<String> endpoints,
    Optional<ChannelConfig> dataAccessConfig,
    Optional<ChannelConfig> sipConfig) {

  public ZoneDescriptor {
    Objects.requireNonNull(id, "Zone id cannot be null");
    Objects.requireNonNull(name, "Zone name cannot be null");
    endpoints = List.copyOf(Objects.requireNonNull(endpoints, "Endpoints cannot be null"));
    Objects.requireNonNull(dataAccessConfig, "Data access config cannot be null");
    Objects.requireNonNull(sipConfig, "Sip config cannot be null");
  }

  /** A zone with default endpoints and no channel overrides. */
  public static ZoneDescriptor of(ZoneId id, String name, List<String> endpoints) {
    return new ZoneDescriptor(id, name, endpoints, Optional.empty(), Optional.empty());
  }

  public ZoneDescriptor withDataAccessConfig(ChannelConfig config) {
    return new ZoneDescriptor(id, name, endpoints, Optional.of(config), sipConfig);
  }

  public ZoneDescriptor withSipConfig(ChannelConfig config) {
    return new ZoneDescriptor(id, name, endpoints, dataAccessConfig, Optional.of(config));
  }

  @Override
  public String toString() {
    return name + "(" + id + ")";
  }
}
