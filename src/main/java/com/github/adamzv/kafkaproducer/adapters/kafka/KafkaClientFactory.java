package com.github.adamzv.kafkaproducer.adapters.kafka;

import com.github.adamzv.kafkaproducer.support.ProducerConfig;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.serialization.ByteArraySerializer;

@FunctionalInterface
public interface KafkaClientFactory {

  Producer<byte[], byte[]> create(ProducerConfig config);

  static KafkaClientFactory standard() {
    return config -> new KafkaProducer<>(
        config.toProperties(),
        new ByteArraySerializer(),
        new ByteArraySerializer()
    );
  }
}
