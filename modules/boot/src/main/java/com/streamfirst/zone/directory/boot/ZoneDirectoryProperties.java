package com.streamfirst.zone.directory.boot;

import com.streamfirst.zone.directory.domain.AccessKey;
import com.streamfirst.zone.directory.domain.ChannelConfig;
import com.streamfirst.zone.directory.domain.CredentialReference;
import com.streamfirst.zone.directory.domain.LocalZoneConfig;
import com.streamfirst.zone.directory.domain.UserRecord;
import com.streamfirst.zone.directory.domain.ZoneDescriptor;
import com.streamfirst.zone.directory.domain.ZoneGroup;
import com.streamfirst.zone.directory.domain.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Static zone topology and credential configuration, bound from the {@code zone-directory}
 * prefix:
 *
 * <pre>
 * zone-directory:
 *   local-zone-id: zone-a
 *   redirect-zone-id: zone-b
 *   system-key:
 *     access-key: SYSTEMKEY
 *     secret: ...
 *   zone-group:
 *     id: zg-1
 *     api-name: default
 *     data-notify-zone-ids: [zone-b]
 *     members:
 *       - id: zone-b
 *         name: b
 *         endpoints: [http://b1:8000]
 *         sip:
 *           endpoints: [http://b-sip:8000]
 *           uid: sync-user
 *     foreign-zones: []
 *   users:
 *     - uid: sync-user
 *       access-keys:
 *         - access-key: SYNCKEY
 *           secret: ...
 * </pre>
 *
 * <p>Secrets belong in environment variables or a secrets manager rather than committed files.
 */
@Data
@ConfigurationProperties(prefix = "zone-directory")
public class ZoneDirectoryProperties {

  /** Id of the zone this process serves. Must be a member of {@link #zoneGroup}. */
  private String localZoneId;

  /** Zone requests are redirected to, unset for no redirect. */
  private String redirectZoneId;

  /** Credentials used towards peers that have nothing more specific configured. */
  private KeyProperties systemKey = new KeyProperties();

  private ZoneGroupProperties zoneGroup = new ZoneGroupProperties();

  /** Zone groups other than the local one, used to find the API name of foreign zones. */
  private List<ZoneGroupProperties> otherZoneGroups = new ArrayList<>();

  /** Users and keys served by the in-memory credential store. */
  private List<UserProperties> users = new ArrayList<>();

  public LocalZoneConfig toLocalZoneConfig() {
    return new LocalZoneConfig(
        ZoneId.of(localZoneId),
        systemKey.toAccessKey(),
        Optional.ofNullable(redirectZoneId).filter(id -> !id.isBlank()).map(ZoneId::of));
  }

  public List<UserRecord> toUserRecords() {
    return users.stream().map(UserProperties::toUserRecord).toList();
  }

  @Data
  public static class ZoneGroupProperties {
    private String id;
    private String name;
    private String apiName;
    private List<ZoneProperties> members = new ArrayList<>();
    private List<ZoneProperties> foreignZones = new ArrayList<>();
    private List<String> dataNotifyZoneIds = new ArrayList<>();

    public ZoneGroup toZoneGroup() {
      return ZoneGroup.builder()
          .id(id)
          .name(name)
          .apiName(apiName)
          .memberZones(members.stream().map(ZoneProperties::toZoneDescriptor).toList())
          .foreignZones(foreignZones.stream().map(ZoneProperties::toZoneDescriptor).toList())
          .dataNotifyZoneIds(dataNotifyZoneIds.stream().map(ZoneId::of).toList())
          .build();
    }
  }

  @Data
  public static class ZoneProperties {
    private String id;

    /** Defaults to the id. */
    private String name;

    private List<String> endpoints = new ArrayList<>();
    private ChannelProperties dataAccess;
    private ChannelProperties sip;

    public ZoneDescriptor toZoneDescriptor() {
      return new ZoneDescriptor(
          ZoneId.of(id),
          name == null ? id : name,
          endpoints,
          Optional.ofNullable(dataAccess).map(ChannelProperties::toChannelConfig),
          Optional.ofNullable(sip).map(ChannelProperties::toChannelConfig));
    }
  }

  /** Channel override. Set at most one of uid, access-key, or access-key with secret. */
  @Data
  public static class ChannelProperties {
    private List<String> endpoints = new ArrayList<>();
    private String uid;
    private String accessKey;
    private String secret;

    /** Blank credential fields count as unset, so the zone falls back to the system key. */
    public ChannelConfig toChannelConfig() {
      return new ChannelConfig(
          endpoints, CredentialReference.of(nonBlank(uid), nonBlank(accessKey), nonBlank(secret)));
    }

    private static Optional<String> nonBlank(String value) {
      return Optional.ofNullable(value).filter(v -> !v.isBlank());
    }
  }

  @Data
  public static class KeyProperties {
    private String accessKey;
    private String secret;

    public AccessKey toAccessKey() {
      return new AccessKey(accessKey, secret == null ? "" : secret);
    }
  }

  @Data
  public static class UserProperties {
    private String uid;
    private List<KeyProperties> accessKeys = new ArrayList<>();

    public UserRecord toUserRecord() {
      Map<String, AccessKey> keys = new LinkedHashMap<>();
      for (KeyProperties key : accessKeys) {
        AccessKey accessKey = key.toAccessKey();
        keys.put(accessKey.id(), accessKey);
      }
      return new UserRecord(uid, keys);
    }
  }
}
