package com.streamfirst.zone.directory.application;

import com.streamfirst.zone.directory.ports.PeerConnection;
import java.util.Objects;

/**
 * The connections held for one peer zone: one for bulk data and one for the sync-index protocol.
 * Both slots refer to the same connection when the zone has no separate sync-index
 * configuration.
 *
 * @param data connection used for data replication traffic
 * @param sip connection used for sync-index traffic
 */
public record ConnectionPair(PeerConnection data, PeerConnection sip) {
  public ConnectionPair {
    Objects.requireNonNull(data, "Data connection cannot be null");
    Objects.requireNonNull(sip, "Sip connection cannot be null");
  }

  /** A pair whose sip slot aliases the data connection. */
  public static ConnectionPair shared(PeerConnection data) {
    return new ConnectionPair(data, data);
  }

  public boolean isSipShared() {
    return data == sip;
  }
}
