package com.github.adamzv.kafkaproducer.ports;

import com.github.adamzv.kafkaproducer.domain.Headers;
import com.github.adamzv.kafkaproducer.domain.ProduceTarget;
import com.github.adamzv.kafkaproducer.domain.RecordMetadata;
import com.github.adamzv.kafkaproducer.domain.Serializer;
import com.github.adamzv.kafkaproducer.domain.Topic;
import java.util.concurrent.CompletableFuture;

/**
 * Sends records to Kafka. Every outcome, including serialization failures, is reported through
 * the returned future: it completes with the broker-confirmed {@link RecordMetadata} or
 * exceptionally with a {@link com.github.adamzv.kafkaproducer.domain.ProblemException}.
 */
public interface KafkaProducerPort {

  <K, V> CompletableFuture<RecordMetadata> produce(
      Topic<K, V> topic,
      V value,
      Serializer<? super V> valueSerializer,
      ProduceTarget<K> target,
      Headers headers);

  default <K, V> CompletableFuture<RecordMetadata> produce(
      Topic<K, V> topic,
      V value,
      Serializer<? super V> valueSerializer,
      ProduceTarget<K> target) {
    return produce(topic, value, valueSerializer, target, Headers.EMPTY);
  }

  default <K, V> CompletableFuture<RecordMetadata> produce(
      Topic<K, V> topic,
      V value,
      Serializer<? super V> valueSerializer) {
    return produce(topic, value, valueSerializer, ProduceTarget.none(), Headers.EMPTY);
  }

  default <K, V> CompletableFuture<RecordMetadata> produce(
      Topic<K, V> topic,
      K key,
      V value,
      Serializer<? super K> keySerializer,
      Serializer<? super V> valueSerializer) {
    return produce(topic, value, valueSerializer, ProduceTarget.key(key, keySerializer), Headers.EMPTY);
  }
}
