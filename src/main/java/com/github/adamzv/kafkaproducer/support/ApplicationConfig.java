package com.github.adamzv.kafkaproducer.support;

import com.github.adamzv.kafkaproducer.adapters.kafka.KafkaClientFactory;
import com.github.adamzv.kafkaproducer.adapters.kafka.KafkaProducerAdapter;
import com.github.adamzv.kafkaproducer.application.ProduceMessageUseCase;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(KafkaProperties.class)
@ComponentScan(basePackageClasses = {ProduceMessageUseCase.class, StartupLogger.class})
public class ApplicationConfig {

  @Bean
  public ProducerConfig producerConfig(KafkaProperties kafkaProperties) {
    return kafkaProperties.toConfig();
  }

  @Bean
  @ConditionalOnMissingBean
  public KafkaClientFactory kafkaClientFactory() {
    return KafkaClientFactory.standard();
  }

  @Bean(destroyMethod = "close")
  public KafkaProducerAdapter kafkaProducerAdapter(ProducerConfig producerConfig, KafkaClientFactory clientFactory) {
    return KafkaProducerAdapter.open(producerConfig, clientFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }
}
