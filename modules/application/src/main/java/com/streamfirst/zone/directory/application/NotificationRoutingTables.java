package com.streamfirst.zone.directory.application;

import com.streamfirst.zone.directory.domain.ZoneId;
import com.streamfirst.zone.directory.ports.PeerConnection;
import java.util.HashMap;
import java.util.Map;

/**
 * Which peer zones are told about local changes, and over which connection. Every member zone of
 * the local zone group gets metadata-change notifications; only zones the topology marks as data
 * notify targets also get data-change notifications.
 */
public final class NotificationRoutingTables {

  private static final NotificationRoutingTables EMPTY =
      new NotificationRoutingTables(Map.of(), Map.of());

  private final Map<ZoneId, PeerConnection> metadataNotifyTo;
  private final Map<ZoneId, PeerConnection> dataNotifyTo;

  private NotificationRoutingTables(
      Map<ZoneId, PeerConnection> metadataNotifyTo, Map<ZoneId, PeerConnection> dataNotifyTo) {
    this.metadataNotifyTo = Map.copyOf(metadataNotifyTo);
    this.dataNotifyTo = Map.copyOf(dataNotifyTo);
  }

  public static NotificationRoutingTables empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<ZoneId, PeerConnection> metadataNotifyTo() {
    return metadataNotifyTo;
  }

  public Map<ZoneId, PeerConnection> dataNotifyTo() {
    return dataNotifyTo;
  }

  public static final class Builder {
    private final Map<ZoneId, PeerConnection> metadataNotifyTo = new HashMap<>();
    private final Map<ZoneId, PeerConnection> dataNotifyTo = new HashMap<>();

    private Builder() {}

    /**
     * Registers a member zone.
     *
     * @param zoneId the zone
     * @param connection connection notifications are sent over
     * @param dataNotify whether the zone also receives data-change notifications
     */
    public Builder register(ZoneId zoneId, PeerConnection connection, boolean dataNotify) {
      metadataNotifyTo.put(zoneId, connection);
      if (dataNotify) {
        dataNotifyTo.put(zoneId, connection);
      }
      return this;
    }

    public NotificationRoutingTables build() {
      return new NotificationRoutingTables(metadataNotifyTo, dataNotifyTo);
    }
  }
}
