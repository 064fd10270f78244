package com.streamfirst.zone.directory.adapters;

import com.streamfirst.zone.directory.domain.AccessKey;
import com.streamfirst.zone.directory.ports.ConnectionPort;
import com.streamfirst.zone.directory.ports.PeerConnection;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ConnectionPort producing {@link RoundRobinPeerConnection}s. Keeps count of the connections it
 * handed out and of those released, which makes leaked or double-released connections visible.
 */
@Slf4j
public class RoundRobinConnectionAdapter implements ConnectionPort {

    private final AtomicInteger constructed = new AtomicInteger();
    private final AtomicInteger released = new AtomicInteger();

    @Override
    public PeerConnection construct(String peerId, List<String> endpoints, AccessKey accessKey,
                                    String zoneGroupId, Optional<String> apiName) {
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("Cannot construct connection to " + peerId + " without endpoints");
        }

        constructed.incrementAndGet();
        log.debug("Constructing connection to {} via {} (zone group {}, api {})",
                peerId, endpoints, zoneGroupId, apiName.orElse("<none>"));

        return new RoundRobinPeerConnection(peerId, endpoints, accessKey, zoneGroupId, apiName,
                released::incrementAndGet);
    }

    public int getConstructedCount() {
        return constructed.get();
    }

    public int getReleasedCount() {
        return released.get();
    }

    public int getOpenCount() {
        return constructed.get() - released.get();
    }

    /**
     * Gets connection statistics for monitoring.
     */
    public Map<String, Integer> getConnectionStats() {
        Map<String, Integer> stats = new HashMap<>();
        stats.put("constructed", constructed.get());
        stats.put("released", released.get());
        stats.put("open", getOpenCount());
        return stats;
    }
}
