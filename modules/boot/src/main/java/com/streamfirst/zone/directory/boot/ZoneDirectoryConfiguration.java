package com.streamfirst.zone.directory.boot;

import com.streamfirst.zone.directory.adapters.InMemoryCredentialStoreAdapter;
import com.streamfirst.zone.directory.adapters.InMemoryTopologyAdapter;
import com.streamfirst.zone.directory.adapters.RoundRobinConnectionAdapter;
import com.streamfirst.zone.directory.application.ConnectionDirectory;
import com.streamfirst.zone.directory.application.ConnectionFactory;
import com.streamfirst.zone.directory.application.CredentialResolver;
import com.streamfirst.zone.directory.application.RedirectResolver;
import com.streamfirst.zone.directory.boot.ZoneDirectoryProperties.ZoneGroupProperties;
import com.streamfirst.zone.directory.ports.ConnectionPort;
import com.streamfirst.zone.directory.ports.CredentialStorePort;
import com.streamfirst.zone.directory.ports.TopologyPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the connection directory. Ports are the in-memory adapters fed from {@link
 * ZoneDirectoryProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ZoneDirectoryProperties.class)
public class ZoneDirectoryConfiguration {

  // --- Ports ---

  @Bean
  public InMemoryTopologyAdapter topologyPort(ZoneDirectoryProperties properties) {
    var topology =
        new InMemoryTopologyAdapter(
            properties.toLocalZoneConfig(), properties.getZoneGroup().toZoneGroup());
    for (ZoneGroupProperties group : properties.getOtherZoneGroups()) {
      topology.registerZoneGroup(group.toZoneGroup());
    }
    return topology;
  }

  @Bean
  public InMemoryCredentialStoreAdapter credentialStorePort(ZoneDirectoryProperties properties) {
    var store = new InMemoryCredentialStoreAdapter();
    properties.toUserRecords().forEach(store::putUser);
    log.info("Credential store loaded with {} users", properties.getUsers().size());
    return store;
  }

  @Bean
  public RoundRobinConnectionAdapter connectionPort() {
    return new RoundRobinConnectionAdapter();
  }

  // --- Application services ---

  @Bean
  public CredentialResolver credentialResolver(CredentialStorePort credentialStore) {
    return new CredentialResolver(credentialStore);
  }

  @Bean
  public ConnectionFactory connectionFactory(
      TopologyPort topology, ConnectionPort connectionPort, CredentialResolver credentialResolver) {
    return new ConnectionFactory(topology, connectionPort, credentialResolver);
  }

  @Bean(initMethod = "init", destroyMethod = "close")
  public ConnectionDirectory connectionDirectory(
      TopologyPort topology, ConnectionFactory connectionFactory) {
    return new ConnectionDirectory(topology, connectionFactory);
  }

  @Bean
  public RedirectResolver redirectResolver(TopologyPort topology, ConnectionDirectory directory) {
    return new RedirectResolver(topology, directory);
  }
}
