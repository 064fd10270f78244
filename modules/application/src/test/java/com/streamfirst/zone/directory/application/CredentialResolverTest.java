package com.streamfirst.zone.directory.application;

import static com.streamfirst.zone.directory.application.ZoneFixtures.SYNC_KEY;
import static com.streamfirst.zone.directory.application.ZoneFixtures.SYSTEM_KEY;
import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.zone.directory.adapters.InMemoryCredentialStoreAdapter;
import com.streamfirst.zone.directory.domain.AccessKey;
import com.streamfirst.zone.directory.domain.CredentialReference;
import com.streamfirst.zone.directory.domain.CredentialReference.AccessKeyOnly;
import com.streamfirst.zone.directory.domain.CredentialReference.AccessKeyWithSecret;
import com.streamfirst.zone.directory.domain.CredentialReference.UserIdentity;
import com.streamfirst.zone.directory.domain.UserRecord;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialResolverTest {

  private InMemoryCredentialStoreAdapter backingStore;
  private RecordingCredentialStore store;
  private CredentialResolver resolver;

  @BeforeEach
  void setUp() {
    backingStore = new InMemoryCredentialStoreAdapter();
    backingStore.putUser(UserRecord.of("sync-user", SYNC_KEY));
    backingStore.putUser(UserRecord.of("keyless"));
    store = new RecordingCredentialStore(backingStore);
    resolver = new CredentialResolver(store);
  }

  @Test
  void keyWithSecretNeedsNoLookup() {
    resolver = new CredentialResolver(store.forbidLookups());

    Optional<AccessKey> key = resolver.resolve("b", new AccessKeyWithSecret("AK", "secret"));

    assertThat(key).contains(new AccessKey("AK", "secret"));
  }

  @Test
  void accessKeyIdIsLookedUpOnce() {
    Optional<AccessKey> key = resolver.resolve("b", new AccessKeyOnly("SYNCKEY"));

    assertThat(key).contains(SYNC_KEY);
    assertThat(store.accessKeyLookups()).containsExactly("SYNCKEY");
    assertThat(store.identityLookups()).isEmpty();
  }

  @Test
  void userIdentityIsLookedUpOnce() {
    Optional<AccessKey> key = resolver.resolve("b", new UserIdentity("sync-user"));

    assertThat(key).contains(SYNC_KEY);
    assertThat(store.identityLookups()).containsExactly("sync-user");
    assertThat(store.accessKeyLookups()).isEmpty();
  }

  @Test
  void looseFieldsFollowPrecedence() {
    Optional<AccessKey> key =
        resolver.resolve("b", Optional.of("keyless"), Optional.of("SYNCKEY"), Optional.empty());

    assertThat(key).contains(SYNC_KEY);
    assertThat(store.accessKeyLookups()).containsExactly("SYNCKEY");
    assertThat(store.identityLookups()).isEmpty();
  }

  @Test
  void nothingConfiguredResolvesToEmptyWithoutLookup() {
    resolver = new CredentialResolver(store.forbidLookups());

    assertThat(resolver.resolve("b", Optional.empty(), Optional.empty(), Optional.empty())).isEmpty();
  }

  @Test
  void unknownUserResolvesToEmpty() {
    assertThat(resolver.resolve("b", new UserIdentity("ghost"))).isEmpty();
    assertThat(resolver.resolve("b", new AccessKeyOnly("NOPE"))).isEmpty();
  }

  @Test
  void userWithoutKeysResolvesToEmpty() {
    assertThat(resolver.resolve("b", new UserIdentity("keyless"))).isEmpty();
  }

  @Test
  void storeFailureResolvesToEmpty() {
    backingStore.markUnavailable(-5);

    assertThat(resolver.resolve("b", new UserIdentity("sync-user"))).isEmpty();
    assertThat(store.identityLookups()).hasSize(1);
  }

  @Test
  void failedResolutionFallsBackToSystemKey() {
    backingStore.markUnavailable(-5);

    AccessKey key =
        resolver.resolveOrSystemKey(
            "b", Optional.of(new UserIdentity("sync-user")), SYSTEM_KEY);

    assertThat(key).isEqualTo(SYSTEM_KEY);
  }

  @Test
  void keylessUserFallsBackToSystemKey() {
    AccessKey key =
        resolver.resolveOrSystemKey("b", Optional.of(new UserIdentity("keyless")), SYSTEM_KEY);

    assertThat(key).isEqualTo(SYSTEM_KEY);
  }

  @Test
  void missingReferenceFallsBackToSystemKey() {
    resolver = new CredentialResolver(store.forbidLookups());

    assertThat(resolver.resolveOrSystemKey("b", Optional.empty(), SYSTEM_KEY)).isEqualTo(SYSTEM_KEY);
  }

  @Test
  void resolvedKeyIsPreferredOverSystemKey() {
    Optional<CredentialReference> ref = Optional.of(new AccessKeyOnly("SYNCKEY"));

    assertThat(resolver.resolveOrSystemKey("b", ref, SYSTEM_KEY)).isEqualTo(SYNC_KEY);
  }
}
