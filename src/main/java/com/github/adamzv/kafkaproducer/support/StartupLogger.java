package com.github.adamzv.kafkaproducer.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Component
public class StartupLogger implements ApplicationListener<ApplicationReadyEvent> {

  private static final Logger log = LoggerFactory.getLogger(StartupLogger.class);

  private final ProducerConfig producerConfig;

  public StartupLogger(ProducerConfig producerConfig) {
    this.producerConfig = producerConfig;
  }

  @Override
  public void onApplicationEvent(ApplicationReadyEvent event) {
    log.info(
        "producer_ready bootstrapServers={} closeTimeoutMs={} clientProperties={}",
        producerConfig.bootstrapServersString(),
        producerConfig.closeTimeout().toMillis(),
        producerConfig.clientProperties().keySet()
    );
  }
}
