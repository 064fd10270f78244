package com.streamfirst.zone.directory.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;

/**
 * A set of zones configured to replicate with each other. Foreign zones are known to the group
 * but replicate outside it; they are reachable but never notified of changes.
 *
 * @param id zone group identifier
 * @param name zone group name
 * @param apiName API name advertised to peers, empty when unset
 * @param memberZones zones of this group, including the local zone
 * @param foreignZones zones outside this group that are still reachable
 * @param dataNotifyZoneIds member zones that receive data-change notifications
 */
@Builder
public record ZoneGroup(
    String id,
    String name,
    String apiName,
    @Singular List<ZoneDescriptor> memberZones,
    @Singular List<ZoneDescriptor> foreignZones,
    @Singular Set<ZoneId> dataNotifyZoneIds) {

  public ZoneGroup {
    Objects.requireNonNull(id, "Zone group id cannot be null");
    name = name == null ? id : name;
    apiName = apiName == null ? "" : apiName;
    memberZones = List.copyOf(memberZones);
    foreignZones = List.copyOf(foreignZones);
    dataNotifyZoneIds = Set.copyOf(dataNotifyZoneIds);
  }

  /** Returns the API name, or empty if none is configured. */
  public Optional<String> apiNameIfSet() {
    return apiName.isEmpty() ? Optional.empty() : Optional.of(apiName);
  }

  public boolean isDataNotifyTarget(ZoneId zoneId) {
    return dataNotifyZoneIds.contains(zoneId);
  }
}
