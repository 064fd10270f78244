package com.streamfirst.zone.directory.boot;

import com.streamfirst.zone.directory.application.ConnectionDirectory;
import com.streamfirst.zone.directory.application.ConnectionPair;
import com.streamfirst.zone.directory.domain.ZoneId;
import com.streamfirst.zone.directory.ports.TopologyPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/** Starts the directory from configuration and logs which peers it can reach. */
@Slf4j
@SpringBootApplication
public class ZoneDirectoryApplication {

  public static void main(String[] args) {
    SpringApplication.run(ZoneDirectoryApplication.class, args);
  }

  @Bean
  public CommandLineRunner connectionSummary(
      ConnectionDirectory directory, TopologyPort topology) {
    return args -> {
      for (ZoneId zoneId : directory.zoneIds()) {
        ConnectionPair pair = directory.connectionsFor(zoneId).orElseThrow();
        log.info(
            "Zone {}: data via {}, sip {}",
            zoneId,
            pair.data().endpoints(),
            pair.isSipShared() ? "shared" : "via " + pair.sip().endpoints());
      }
      log.info("Metadata notify targets: {}", directory.metadataNotifyTargets().keySet());
      log.info("Data notify targets: {}", directory.dataNotifyTargets().keySet());
      log.info(
          "Redirect zone: {}",
          topology.localZoneConfig().redirectZoneId().map(ZoneId::value).orElse("<none>"));
    };
  }
}
