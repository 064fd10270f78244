package com.streamfirst.zone.directory.ports;

import com.streamfirst.zone.directory.domain.LocalZoneConfig;
import com.streamfirst.zone.directory.domain.ZoneGroup;
import com.streamfirst.zone.directory.domain.ZoneId;
import java.util.Optional;

/**
 * Port for the zone topology source of truth. Publishes the local zone, the zone group it belongs
 * to, and the zones known through that group. The connection directory only reads from it.
 */
public interface TopologyPort {

  /**
   * Gets the id of the zone this process serves.
   *
   * @return the local zone id
   */
  ZoneId localZoneId();

  /**
   * Gets the zone group the local zone belongs to, with its member and foreign zones.
   *
   * @return the local zone group
   */
  ZoneGroup localZoneGroup();

  /**
   * Finds the zone group a zone is a member of.
   *
   * @param zoneId the zone to look up
   * @return the zone group, or empty if the zone is not a member of any known group
   */
  Optional<ZoneGroup> zoneGroupOf(ZoneId zoneId);

  /**
   * Resolves a zone name to its id.
   *
   * @param name the zone name
   * @return the zone id, or empty if no zone has that name
   */
  Optional<ZoneId> findZoneIdByName(String name);

  /**
   * Gets the configuration of the local zone: its system key and optional redirect zone.
   *
   * @return the local zone configuration
   */
  LocalZoneConfig localZoneConfig();
}
