package com.github.adamzv.kafkaproducer.support;

import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "kafka")
public record KafkaProperties(
    @NotEmpty(message = "kafka.bootstrapServers must not be empty")
    List<String> bootstrapServers,
    String clientId,
    @DefaultValue("30s")
    Duration closeTimeout,
    Map<String, String> producer
) {

  public ProducerConfig toConfig() {
    Map<String, String> clientProperties = new LinkedHashMap<>();
    if (producer != null) {
      clientProperties.putAll(producer);
    }
    if (clientId != null && !clientId.isBlank()) {
      clientProperties.put(org.apache.kafka.clients.producer.ProducerConfig.CLIENT_ID_CONFIG, clientId);
    }
    return new ProducerConfig(new LinkedHashSet<>(bootstrapServers), clientProperties, closeTimeout);
  }
}
