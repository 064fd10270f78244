package com.streamfirst.zone.directory.ports;

import com.streamfirst.zone.directory.domain.AccessKey;
import com.streamfirst.zone.directory.domain.Result;
import java.util.List;
import java.util.Optional;

/**
 * Handle to a connection towards a peer, produced by a {@link ConnectionPort}. The directory does
 * not inspect it beyond {@link #reachableEndpoint()} and releases it with {@link #close()}.
 */
public interface PeerConnection extends AutoCloseable {

  String remoteId();

  List<String> endpoints();

  AccessKey accessKey();

  String zoneGroupId();

  Optional<String> apiName();

  /**
   * Picks an endpoint requests can currently be sent to.
   *
   * @return the endpoint URL, or a failure if none is usable
   */
  Result<String> reachableEndpoint();

  /** Releases the connection. Calling it more than once has no further effect. */
  @Override
  void close();
}
