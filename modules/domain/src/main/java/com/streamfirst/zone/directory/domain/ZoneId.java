package com.streamfirst.zone.directory.domain;

import java.util.Objects;

/**
 * Stable identifier of a zone in the replicated cluster. Zone ids are assigned by the topology
 * store and never change for the lifetime of the zone, unlike zone names.
 *
 * @param value the zone identifier (typically a UUID string)
 */
public record ZoneId(String value) {
  public ZoneId {
    Objects.requireNonNull(value, "Zone ID cannot be null");
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException("Zone ID cannot be empty");
    }
  }

  /** Creates a ZoneId from a string value. */
  public static ZoneId of(String value) {
    return new ZoneId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
