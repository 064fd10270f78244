package com.streamfirst.zone.directory.application;

import com.streamfirst.zone.directory.domain.ZoneDescriptor;
import com.streamfirst.zone.directory.domain.ZoneGroup;
import com.streamfirst.zone.directory.domain.ZoneId;
import com.streamfirst.zone.directory.ports.PeerConnection;
import com.streamfirst.zone.directory.ports.TopologyPort;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds one {@link ConnectionPair} per reachable peer zone for the lifetime of the process, plus
 * the notification routing tables of the local zone group.
 *
 * <p>{@link #init()} builds everything in one pass and publishes an immutable snapshot, so
 * lookups never observe a partially built directory. Once published, a zone's pair is never
 * replaced. {@link #close()} releases every connection the directory created, each exactly once
 * even when the data and sip slots share it.
 */
@Slf4j
@RequiredArgsConstructor
public class ConnectionDirectory implements AutoCloseable {

  private final TopologyPort topology;
  private final ConnectionFactory connectionFactory;

  private volatile Map<ZoneId, ConnectionPair> connections = Map.of();
  private volatile NotificationRoutingTables routing = NotificationRoutingTables.empty();

  private boolean initialized;
  private boolean closed;

  /**
   * Builds connections to every member zone of the local zone group, then to its foreign zones.
   * Member zones are also registered for change notifications. Calling it again has no effect.
   *
   * @throws IllegalStateException if the directory was already closed
   */
  public synchronized void init() {
    if (closed) {
      throw new IllegalStateException("Connection directory is closed");
    }
    if (initialized) {
      log.warn("Connection directory already initialized with {} zones", connections.size());
      return;
    }

    ZoneGroup zoneGroup = topology.localZoneGroup();
    log.info(
        "Initializing zone connections for zone group {} ({} members, {} foreign zones)",
        zoneGroup.id(),
        zoneGroup.memberZones().size(),
        zoneGroup.foreignZones().size());

    Build build = new Build(topology.localZoneId(), zoneGroup);
    try {
      for (ZoneDescriptor zone : zoneGroup.memberZones()) {
        build.buildConnection(zone, true);
      }
      for (ZoneDescriptor zone : zoneGroup.foreignZones()) {
        build.buildConnection(zone, false);
      }
    } catch (RuntimeException e) {
      log.error("Zone connection initialization failed, releasing partial connections", e);
      release(build.pairs.values());
      throw e;
    }

    routing = build.tables.build();
    connections = Map.copyOf(build.pairs);
    initialized = true;

    log.info(
        "Zone connections ready: {} zones, {} metadata notify targets, {} data notify targets",
        connections.size(),
        routing.metadataNotifyTo().size(),
        routing.dataNotifyTo().size());
  }

  /**
   * Gets the connections to a zone.
   *
   * @param zoneId the zone id
   * @return the zone's connections, or empty if the zone is unknown or unreachable
   */
  public Optional<ConnectionPair> connectionsFor(ZoneId zoneId) {
    return Optional.ofNullable(connections.get(zoneId));
  }

  /**
   * Gets the connections to a zone by name.
   *
   * @param zoneName the zone name
   * @return the zone's connections, or empty if no zone has that name or it is unreachable
   */
  public Optional<ConnectionPair> connectionsFor(String zoneName) {
    Optional<ZoneId> zoneId = topology.findZoneIdByName(zoneName);
    if (zoneId.isEmpty()) {
      log.debug("No zone named {}", zoneName);
      return Optional.empty();
    }
    return connectionsFor(zoneId.get());
  }

  /** Member zones that receive metadata-change notifications, with their data connection. */
  public Map<ZoneId, PeerConnection> metadataNotifyTargets() {
    return routing.metadataNotifyTo();
  }

  /** Member zones that receive data-change notifications, with their data connection. */
  public Map<ZoneId, PeerConnection> dataNotifyTargets() {
    return routing.dataNotifyTo();
  }

  public Set<ZoneId> zoneIds() {
    return connections.keySet();
  }

  public int size() {
    return connections.size();
  }

  public synchronized boolean isInitialized() {
    return initialized;
  }

  /**
   * Releases every connection and empties the directory. Further lookups return empty. Closing an
   * already closed directory does nothing.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;

    Collection<ConnectionPair> pairs = connections.values();
    connections = Map.of();
    routing = NotificationRoutingTables.empty();

    log.info("Released {} zone connections", release(pairs));
  }

  /** Closes each distinct connection of the pairs once, returning how many were closed. */
  private static int release(Collection<ConnectionPair> pairs) {
    Set<PeerConnection> owned = Collections.newSetFromMap(new IdentityHashMap<>());
    for (ConnectionPair pair : pairs) {
      owned.add(pair.data());
      owned.add(pair.sip());
    }
    for (PeerConnection connection : owned) {
      try {
        connection.close();
      } catch (RuntimeException e) {
        log.error("Failed to release connection to {}", connection.remoteId(), e);
      }
    }
    return owned.size();
  }

  /** State of one {@link #init()} pass. */
  private final class Build {
    private final ZoneId localZoneId;
    private final ZoneGroup zoneGroup;
    private final Map<ZoneId, ConnectionPair> pairs = new HashMap<>();
    private final NotificationRoutingTables.Builder tables = NotificationRoutingTables.builder();

    Build(ZoneId localZoneId, ZoneGroup zoneGroup) {
      this.localZoneId = localZoneId;
      this.zoneGroup = zoneGroup;
    }

    void buildConnection(ZoneDescriptor zone, boolean needsNotify) {
      if (zone.id().equals(localZoneId)) {
        return;
      }
      if (pairs.containsKey(zone.id())) {
        log.warn("Zone {} listed more than once, keeping its first connection", zone);
        return;
      }

      List<String> defaultEndpoints = ConnectionFactory.defaultEndpoints(zone);
      if (defaultEndpoints.isEmpty()) {
        log.warn("Can't generate connection for zone {}: no data endpoints defined", zone);
        return;
      }

      Optional<String> apiName = connectionFactory.apiNameFor(zone.id());
      log.debug("Generating connection object for zone {}", zone);

      Optional<PeerConnection> data =
          zone.dataAccessConfig().isPresent()
              ? connectionFactory.create(
                  zone, defaultEndpoints, zone.dataAccessConfig().get(), apiName)
              : connectionFactory.createDefault(zone, apiName);
      if (data.isEmpty()) {
        return;
      }

      ConnectionPair pair;
      try {
        pair =
            zone.sipConfig()
                .flatMap(sip -> connectionFactory.create(zone, defaultEndpoints, sip, apiName))
                .map(sip -> new ConnectionPair(data.get(), sip))
                .orElseGet(() -> ConnectionPair.shared(data.get()));
      } catch (RuntimeException e) {
        // not yet in pairs, so the caller cannot release it
        release(List.of(ConnectionPair.shared(data.get())));
        throw e;
      }
      pairs.put(zone.id(), pair);

      if (needsNotify) {
        tables.register(zone.id(), pair.data(), zoneGroup.isDataNotifyTarget(zone.id()));
      }
    }
  }
}
