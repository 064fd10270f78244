package com.streamfirst.zone.directory.application;

import static com.streamfirst.zone.directory.application.ZoneFixtures.A;
import static com.streamfirst.zone.directory.application.ZoneFixtures.B;
import static com.streamfirst.zone.directory.application.ZoneFixtures.C;
import static com.streamfirst.zone.directory.application.ZoneFixtures.D;
import static com.streamfirst.zone.directory.application.ZoneFixtures.F;
import static com.streamfirst.zone.directory.application.ZoneFixtures.SYNC_KEY;
import static com.streamfirst.zone.directory.application.ZoneFixtures.SYSTEM_KEY;
import static com.streamfirst.zone.directory.application.ZoneFixtures.localGroup;
import static com.streamfirst.zone.directory.application.ZoneFixtures.localZone;
import static com.streamfirst.zone.directory.application.ZoneFixtures.zone;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.zone.directory.adapters.InMemoryCredentialStoreAdapter;
import com.streamfirst.zone.directory.adapters.InMemoryTopologyAdapter;
import com.streamfirst.zone.directory.adapters.RoundRobinConnectionAdapter;
import com.streamfirst.zone.directory.domain.AccessKey;
import com.streamfirst.zone.directory.domain.ChannelConfig;
import com.streamfirst.zone.directory.domain.CredentialReference.AccessKeyOnly;
import com.streamfirst.zone.directory.domain.CredentialReference.UserIdentity;
import com.streamfirst.zone.directory.domain.UserRecord;
import com.streamfirst.zone.directory.domain.ZoneGroup;
import com.streamfirst.zone.directory.ports.ConnectionPort;
import com.streamfirst.zone.directory.ports.PeerConnection;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectionDirectoryTest {

  private InMemoryCredentialStoreAdapter credentialStore;
  private RoundRobinConnectionAdapter connectionPort;

  @BeforeEach
  void setUp() {
    credentialStore = new InMemoryCredentialStoreAdapter();
    credentialStore.putUser(UserRecord.of("sync-user", SYNC_KEY));
    connectionPort = new RoundRobinConnectionAdapter();
  }

  private ConnectionDirectory directoryFor(ZoneGroup group) {
    return directoryFor(group, connectionPort);
  }

  private ConnectionDirectory directoryFor(ZoneGroup group, ConnectionPort port) {
    var topology = new InMemoryTopologyAdapter(localZone(), group);
    var factory = new ConnectionFactory(topology, port, new CredentialResolver(credentialStore));
    return new ConnectionDirectory(topology, factory);
  }

  /** Delegates to the shared adapter but fails the given construct call. */
  private ConnectionPort failingOnConstruct(int failingCall) {
    return new ConnectionPort() {
      private int calls;

      @Override
      public PeerConnection construct(
          String peerId,
          List<String> endpoints,
          AccessKey accessKey,
          String zoneGroupId,
          Optional<String> apiName) {
        if (++calls == failingCall) {
          throw new IllegalStateException("connection backend unavailable");
        }
        return connectionPort.construct(peerId, endpoints, accessKey, zoneGroupId, apiName);
      }
    };
  }

  /** B: plain, data-notify. C: sip override. F: foreign. */
  private ZoneGroup standardGroup() {
    return localGroup()
        .memberZone(zone(B, "http://b:8000"))
        .memberZone(
            zone(C, "http://c:8000")
                .withSipConfig(
                    new ChannelConfig(
                        List.of("http://c-sip:8000"), Optional.of(new UserIdentity("sync-user")))))
        .foreignZone(zone(F, "http://f:8000"))
        .dataNotifyZoneId(B)
        .build();
  }

  @Test
  void buildsPairsForPeersButNotForSelf() {
    ConnectionDirectory directory = directoryFor(standardGroup());
    directory.init();

    assertThat(directory.zoneIds()).containsExactlyInAnyOrder(B, C, F);
    assertThat(directory.connectionsFor(A)).isEmpty();
    assertThat(directory.isInitialized()).isTrue();
  }

  @Test
  void sipAliasesDataWithoutOverride() {
    ConnectionDirectory directory = directoryFor(standardGroup());
    directory.init();

    ConnectionPair b = directory.connectionsFor(B).orElseThrow();
    assertThat(b.sip()).isSameAs(b.data());
    assertThat(b.isSipShared()).isTrue();
    assertThat(b.data().accessKey()).isEqualTo(SYSTEM_KEY);
  }

  @Test
  void sipOverrideGetsItsOwnConnection() {
    ConnectionDirectory directory = directoryFor(standardGroup());
    directory.init();

    ConnectionPair c = directory.connectionsFor(C).orElseThrow();
    assertThat(c.sip()).isNotSameAs(c.data());
    assertThat(c.data().endpoints()).containsExactly("http://c:8000");
    assertThat(c.sip().endpoints()).containsExactly("http://c-sip:8000");
    assertThat(c.sip().accessKey()).isEqualTo(SYNC_KEY);
    assertThat(c.data().accessKey()).isEqualTo(SYSTEM_KEY);
  }

  @Test
  void dataAccessOverrideDrivesDataConnection() {
    ConnectionDirectory directory =
        directoryFor(
            localGroup()
                .memberZone(
                    zone(B, "http://b:8000")
                        .withDataAccessConfig(
                            new ChannelConfig(
                                List.of("http://b-data:8000"),
                                Optional.of(new AccessKeyOnly("SYNCKEY")))))
                .build());
    directory.init();

    ConnectionPair b = directory.connectionsFor(B).orElseThrow();
    assertThat(b.data().endpoints()).containsExactly("http://b-data:8000");
    assertThat(b.data().accessKey()).isEqualTo(SYNC_KEY);
    assertThat(b.isSipShared()).isTrue();
  }

  @Test
  void sipOverrideWithoutEndpointsUsesDataAccessEndpointsWhenZoneHasNone() {
    ConnectionDirectory directory =
        directoryFor(
            localGroup()
                .memberZone(
                    zone(B)
                        .withDataAccessConfig(ChannelConfig.ofEndpoints(List.of("http://b-data:8000")))
                        .withSipConfig(ChannelConfig.ofCredentials(new UserIdentity("sync-user"))))
                .build());
    directory.init();

    ConnectionPair b = directory.connectionsFor(B).orElseThrow();
    assertThat(b.sip().endpoints()).containsExactly("http://b-data:8000");
    assertThat(b.sip()).isNotSameAs(b.data());
  }

  @Test
  void zoneWithoutEndpointsIsSkipped() {
    ConnectionDirectory directory =
        directoryFor(
            localGroup()
                .memberZone(zone(B, "http://b:8000"))
                .memberZone(zone(D).withSipConfig(ChannelConfig.ofEndpoints(List.of("http://d-sip:8000"))))
                .dataNotifyZoneId(D)
                .build());
    directory.init();

    assertThat(directory.connectionsFor(D)).isEmpty();
    assertThat(directory.zoneIds()).containsExactly(B);
    assertThat(directory.metadataNotifyTargets()).doesNotContainKey(D);
    assertThat(directory.dataNotifyTargets()).doesNotContainKey(D);
  }

  @Test
  void notificationTablesCoverMembersOnly() {
    ConnectionDirectory directory = directoryFor(standardGroup());
    directory.init();

    assertThat(directory.metadataNotifyTargets()).containsOnlyKeys(B, C);
    assertThat(directory.dataNotifyTargets()).containsOnlyKeys(B);
    assertThat(directory.metadataNotifyTargets().get(C))
        .isSameAs(directory.connectionsFor(C).orElseThrow().data());
  }

  @Test
  void foreignZoneMarkedForDataNotifyIsStillNotNotified() {
    ConnectionDirectory directory =
        directoryFor(localGroup().foreignZone(zone(F, "http://f:8000")).dataNotifyZoneId(F).build());
    directory.init();

    assertThat(directory.connectionsFor(F)).isPresent();
    assertThat(directory.metadataNotifyTargets()).isEmpty();
    assertThat(directory.dataNotifyTargets()).isEmpty();
  }

  @Test
  void duplicateZoneKeepsFirstPair() {
    ConnectionDirectory directory =
        directoryFor(
            localGroup()
                .memberZone(zone(B, "http://b:8000"))
                .foreignZone(zone(B, "http://b-other:8000"))
                .build());
    directory.init();

    assertThat(directory.connectionsFor(B).orElseThrow().data().endpoints())
        .containsExactly("http://b:8000");
    assertThat(connectionPort.getConstructedCount()).isEqualTo(1);
  }

  @Test
  void lookupByName() {
    ConnectionDirectory directory = directoryFor(standardGroup());
    directory.init();

    assertThat(directory.connectionsFor("c")).isEqualTo(directory.connectionsFor(C));
    assertThat(directory.connectionsFor("a")).isEmpty();
    assertThat(directory.connectionsFor("unknown")).isEmpty();
  }

  @Test
  void lookupsBeforeInitAreEmpty() {
    ConnectionDirectory directory = directoryFor(standardGroup());

    assertThat(directory.connectionsFor(B)).isEmpty();
    assertThat(directory.metadataNotifyTargets()).isEmpty();
    assertThat(directory.isInitialized()).isFalse();
  }

  @Test
  void secondInitDoesNotRebuild() {
    ConnectionDirectory directory = directoryFor(standardGroup());
    directory.init();
    ConnectionPair before = directory.connectionsFor(B).orElseThrow();
    int constructed = connectionPort.getConstructedCount();

    directory.init();

    assertThat(directory.connectionsFor(B).orElseThrow()).isSameAs(before);
    assertThat(connectionPort.getConstructedCount()).isEqualTo(constructed);
  }

  @Test
  void rebuildingFromSameTopologyIsEquivalent() {
    ConnectionDirectory first = directoryFor(standardGroup());
    ConnectionDirectory second = directoryFor(standardGroup());
    first.init();
    second.init();

    assertThat(second.zoneIds()).isEqualTo(first.zoneIds());
    for (var zoneId : first.zoneIds()) {
      ConnectionPair a = first.connectionsFor(zoneId).orElseThrow();
      ConnectionPair b = second.connectionsFor(zoneId).orElseThrow();
      assertThat(b.isSipShared()).isEqualTo(a.isSipShared());
      assertThat(b.data().endpoints()).isEqualTo(a.data().endpoints());
      assertThat(b.sip().endpoints()).isEqualTo(a.sip().endpoints());
    }
    assertThat(second.dataNotifyTargets().keySet()).isEqualTo(first.dataNotifyTargets().keySet());
  }

  @Test
  void closeReleasesEachConnectionOnce() {
    ConnectionDirectory directory = directoryFor(standardGroup());
    directory.init();

    // B and F share data/sip, C has two connections
    assertThat(connectionPort.getConstructedCount()).isEqualTo(4);

    directory.close();
    directory.close();

    assertThat(connectionPort.getReleasedCount()).isEqualTo(4);
    assertThat(connectionPort.getOpenCount()).isZero();
    assertThat(directory.connectionsFor(B)).isEmpty();
    assertThat(directory.metadataNotifyTargets()).isEmpty();
  }

  @Test
  void failedInitReleasesConnectionsAlreadyBuilt() {
    ConnectionDirectory directory =
        directoryFor(
            localGroup()
                .memberZone(zone(B, "http://b:8000"))
                .memberZone(zone(C, "http://c:8000"))
                .build(),
            failingOnConstruct(2));

    assertThatThrownBy(directory::init).isInstanceOf(IllegalStateException.class);

    assertThat(connectionPort.getConstructedCount()).isEqualTo(1);
    assertThat(connectionPort.getOpenCount()).isZero();
    assertThat(directory.isInitialized()).isFalse();
    assertThat(directory.zoneIds()).isEmpty();
  }

  @Test
  void failedSipConstructReleasesItsDataConnection() {
    ConnectionDirectory directory =
        directoryFor(
            localGroup()
                .memberZone(zone(B, "http://b:8000"))
                .memberZone(
                    zone(C, "http://c:8000")
                        .withSipConfig(ChannelConfig.ofEndpoints(List.of("http://c-sip:8000"))))
                .build(),
            failingOnConstruct(3));

    assertThatThrownBy(directory::init).isInstanceOf(IllegalStateException.class);

    assertThat(connectionPort.getConstructedCount()).isEqualTo(2);
    assertThat(connectionPort.getOpenCount()).isZero();
  }

  @Test
  void initAfterCloseIsRejected() {
    ConnectionDirectory directory = directoryFor(standardGroup());
    directory.close();

    assertThatThrownBy(directory::init).isInstanceOf(IllegalStateException.class);
  }
}
