package com.streamfirst.zone.directory.adapters;

import com.streamfirst.zone.directory.domain.AccessKey;
import com.streamfirst.zone.directory.domain.Result;
import com.streamfirst.zone.directory.ports.PeerConnection;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connection metadata towards one peer. Each call to {@link #reachableEndpoint()} advances to the
 * next endpoint of the list, spreading requests over all endpoints of the peer.
 */
@Slf4j
public final class RoundRobinPeerConnection implements PeerConnection {

    /** Error code reported when no endpoint can be returned (EIO). */
    public static final int EIO = -5;

    private final String remoteId;
    private final List<String> endpoints;
    private final AccessKey accessKey;
    private final String zoneGroupId;
    private final Optional<String> apiName;
    private final Runnable onClose;

    private final AtomicLong counter;
    private final AtomicBoolean closed = new AtomicBoolean();

    RoundRobinPeerConnection(String remoteId, List<String> endpoints, AccessKey accessKey,
                             String zoneGroupId, Optional<String> apiName, Runnable onClose) {
        this(remoteId, endpoints, accessKey, zoneGroupId, apiName, onClose, 0L);
    }

    RoundRobinPeerConnection(String remoteId, List<String> endpoints, AccessKey accessKey,
                             String zoneGroupId, Optional<String> apiName, Runnable onClose,
                             long startPosition) {
        this.remoteId = Objects.requireNonNull(remoteId, "Remote id cannot be null");
        this.endpoints = List.copyOf(endpoints);
        this.accessKey = Objects.requireNonNull(accessKey, "Access key cannot be null");
        this.zoneGroupId = Objects.requireNonNull(zoneGroupId, "Zone group id cannot be null");
        this.apiName = Objects.requireNonNull(apiName, "Api name cannot be null");
        this.onClose = onClose;
        this.counter = new AtomicLong(startPosition);
    }

    @Override
    public String remoteId() {
        return remoteId;
    }

    @Override
    public List<String> endpoints() {
        return endpoints;
    }

    @Override
    public AccessKey accessKey() {
        return accessKey;
    }

    @Override
    public String zoneGroupId() {
        return zoneGroupId;
    }

    @Override
    public Optional<String> apiName() {
        return apiName;
    }

    @Override
    public Result<String> reachableEndpoint() {
        if (closed.get()) {
            return Result.failure("connection to " + remoteId + " is closed", EIO);
        }
        if (endpoints.isEmpty()) {
            log.error("Connection to {} has no endpoints", remoteId);
            return Result.failure("no endpoints for " + remoteId, EIO);
        }

        int index = Math.floorMod(counter.getAndIncrement(), endpoints.size());
        return Result.success(endpoints.get(index));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Closed connection to {}", remoteId);
            onClose.run();
        }
    }

    @Override
    public String toString() {
        return "RoundRobinPeerConnection{" +
               "remoteId='" + remoteId + '\'' +
               ", endpoints=" + endpoints +
               ", accessKeyId=" + accessKey.id() +
               ", zoneGroupId=" + zoneGroupId +
               ", closed=" + closed.get() +
               '}';
    }
}
