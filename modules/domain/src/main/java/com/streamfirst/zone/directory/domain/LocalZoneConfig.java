package com.streamfirst.zone.directory.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of the zone this process serves.
 *
 * @param zoneId the local zone
 * @param systemKey default credential used towards peers when nothing more specific resolves
 * @param redirectZoneId peer zone that requests are redirected to, if configured
 */
public record LocalZoneConfig(ZoneId zoneId, AccessKey systemKey, Optional<ZoneId> redirectZoneId) {
  public LocalZoneConfig {
    Objects.requireNonNull(zoneId, "Zone id cannot be null");
    Objects.requireNonNull(systemKey, "System key cannot be null");
    Objects.requireNonNull(redirectZoneId, "Redirect zone id cannot be null, use Optional.empty()");
  }

  public static LocalZoneConfig of(ZoneId zoneId, AccessKey systemKey) {
    return new LocalZoneConfig(zoneId, systemKey, Optional.empty());
  }

  public LocalZoneConfig withRedirectZone(ZoneId redirectZoneId) {
    return new LocalZoneConfig(zoneId, systemKey, Optional.of(redirectZoneId));
  }
}
