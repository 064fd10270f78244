package com.streamfirst.zone.directory.adapters;

import com.streamfirst.zone.directory.domain.LocalZoneConfig;
import com.streamfirst.zone.directory.domain.ZoneDescriptor;
import com.streamfirst.zone.directory.domain.ZoneGroup;
import com.streamfirst.zone.directory.domain.ZoneId;
import com.streamfirst.zone.directory.ports.TopologyPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * In-memory implementation of TopologyPort for testing and for deployments configured from
 * static properties. Holds the local zone, its zone group and any other known zone groups.
 */
@Slf4j
public class InMemoryTopologyAdapter implements TopologyPort {

    private volatile LocalZoneConfig localZoneConfig;
    private volatile ZoneGroup localZoneGroup;

    // Every known zone group by id, including the local one
    private final Map<String, ZoneGroup> zoneGroups = new ConcurrentHashMap<>();

    public InMemoryTopologyAdapter(LocalZoneConfig localZoneConfig, ZoneGroup localZoneGroup) {
        setLocalZone(localZoneConfig, localZoneGroup);
    }

    /**
     * Replaces the local zone and its zone group.
     *
     * @throws IllegalArgumentException if the local zone is not a member of the group
     */
    public void setLocalZone(LocalZoneConfig config, ZoneGroup group) {
        Objects.requireNonNull(config, "Local zone config cannot be null");
        Objects.requireNonNull(group, "Local zone group cannot be null");

        boolean member = group.memberZones().stream().anyMatch(z -> z.id().equals(config.zoneId()));
        if (!member) {
            throw new IllegalArgumentException(
                "Local zone " + config.zoneId() + " is not a member of zone group " + group.id());
        }

        if (localZoneGroup != null) {
            zoneGroups.remove(localZoneGroup.id());
        }
        this.localZoneConfig = config;
        this.localZoneGroup = group;
        zoneGroups.put(group.id(), group);

        log.info("Local zone set to {} in zone group {} ({} members, {} foreign zones)",
                config.zoneId(), group.id(), group.memberZones().size(), group.foreignZones().size());
    }

    /**
     * Registers a zone group other than the local one, so that foreign zones can be mapped to
     * the group they belong to.
     */
    public void registerZoneGroup(ZoneGroup group) {
        if (group.id().equals(localZoneGroup.id())) {
            throw new IllegalArgumentException("Zone group " + group.id() + " is the local zone group");
        }
        zoneGroups.put(group.id(), group);
        log.info("Registered zone group {} with {} members", group.id(), group.memberZones().size());
    }

    public void setRedirectZone(ZoneId redirectZoneId) {
        localZoneConfig = localZoneConfig.withRedirectZone(redirectZoneId);
        log.info("Redirect zone set to {}", redirectZoneId);
    }

    @Override
    public ZoneId localZoneId() {
        return localZoneConfig.zoneId();
    }

    @Override
    public ZoneGroup localZoneGroup() {
        return localZoneGroup;
    }

    @Override
    public Optional<ZoneGroup> zoneGroupOf(ZoneId zoneId) {
        Optional<ZoneGroup> group = zoneGroups.values().stream()
                .filter(g -> g.memberZones().stream().anyMatch(z -> z.id().equals(zoneId)))
                .findFirst();

        if (group.isEmpty()) {
            log.debug("Zone {} is not a member of any known zone group", zoneId);
        }
        return group;
    }

    @Override
    public Optional<ZoneId> findZoneIdByName(String name) {
        Optional<ZoneId> id = allZones()
                .filter(z -> z.name().equals(name))
                .map(ZoneDescriptor::id)
                .findFirst();

        log.debug("Zone name {} resolved to {}", name, id.map(ZoneId::value).orElse("<none>"));
        return id;
    }

    @Override
    public LocalZoneConfig localZoneConfig() {
        return localZoneConfig;
    }

    private Stream<ZoneDescriptor> allZones() {
        return zoneGroups.values().stream()
                .flatMap(g -> Stream.concat(g.memberZones().stream(), g.foreignZones().stream()));
    }
}
