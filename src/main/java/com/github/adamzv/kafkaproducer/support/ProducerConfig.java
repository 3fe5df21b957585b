package com.github.adamzv.kafkaproducer.support;

import com.github.adamzv.kafkaproducer.domain.Problems;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

public record ProducerConfig(
    Set<String> bootstrapServers,
    Map<String, String> clientProperties,
    Duration closeTimeout
) {

  public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(30);

  public ProducerConfig {
    if (bootstrapServers == null || bootstrapServers.isEmpty()) {
      throw Problems.invalidArgument("At least one bootstrap server is required", Map.of());
    }
    for (String server : bootstrapServers) {
      if (server == null || server.isBlank()) {
        throw Problems.invalidArgument("Bootstrap servers must not be blank", Map.of());
      }
    }
    if (closeTimeout != null && closeTimeout.isNegative()) {
      throw Problems.invalidArgument("Close timeout must not be negative", Map.of("closeTimeout", closeTimeout));
    }
    bootstrapServers = Collections.unmodifiableSet(new LinkedHashSet<>(bootstrapServers));
    clientProperties = clientProperties == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(clientProperties));
    closeTimeout = closeTimeout == null ? DEFAULT_CLOSE_TIMEOUT : closeTimeout;
  }

  public ProducerConfig(Set<String> bootstrapServers) {
    this(bootstrapServers, Map.of(), DEFAULT_CLOSE_TIMEOUT);
  }

  public static ProducerConfig of(String... bootstrapServers) {
    return new ProducerConfig(new LinkedHashSet<>(List.of(bootstrapServers)));
  }

  public String bootstrapServersString() {
    return String.join(",", bootstrapServers);
  }

  public Properties toProperties() {
    Properties props = new Properties();
    clientProperties.forEach(props::setProperty);
    props.setProperty(
        org.apache.kafka.clients.producer.ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
        bootstrapServersString()
    );
    return props;
  }
}
