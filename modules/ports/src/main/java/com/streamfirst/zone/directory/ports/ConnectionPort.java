package com.streamfirst.zone.directory.ports;

import com.streamfirst.zone.directory.domain.AccessKey;
import java.util.List;
import java.util.Optional;

/**
 * Port for the REST connection implementation. Building a connection only assembles metadata; no
 * network round trip happens until the connection is used for a request.
 */
public interface ConnectionPort {

  /**
   * Constructs a connection to a remote peer.
   *
   * @param peerId id of the remote zone or service
   * @param endpoints endpoints to send requests to, never empty
   * @param accessKey credentials used to sign requests
   * @param zoneGroupId id of the local zone group, sent to identify the caller
   * @param apiName API name of the peer's zone group, if known
   * @return a new connection owned by the caller
   */
  PeerConnection construct(
      String peerId,
      List<String> endpoints,
      AccessKey accessKey,
      String zoneGroupId,
      Optional<String> apiName);
}
