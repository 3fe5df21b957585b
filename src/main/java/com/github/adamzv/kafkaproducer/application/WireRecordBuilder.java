package com.github.adamzv.kafkaproducer.application;

import com.github.adamzv.kafkaproducer.domain.Headers;
import com.github.adamzv.kafkaproducer.domain.ProduceTarget;
import com.github.adamzv.kafkaproducer.domain.Problems;
import com.github.adamzv.kafkaproducer.domain.SerializationError;
import com.github.adamzv.kafkaproducer.domain.Serializer;
import com.github.adamzv.kafkaproducer.domain.Topic;
import com.github.adamzv.kafkaproducer.domain.WireRecord;

public class WireRecordBuilder {

  public <K, V> WireRecord build(
      Topic<K, V> topic,
      V value,
      Serializer<? super V> valueSerializer,
      ProduceTarget<K> target,
      Headers headers) throws SerializationError {
    String name = topic.name();
    Headers recordHeaders = headers == null ? Headers.EMPTY : headers;
    ProduceTarget<K> recordTarget = target == null ? ProduceTarget.none() : target;

    return recordTarget.accept(new ProduceTarget.Visitor<K, WireRecord>() {
      @Override
      public WireRecord none() {
        byte[] valueBytes = serialize(name, value, valueSerializer);
        return new WireRecord(name, null, valueBytes, null, recordHeaders);
      }

      @Override
      public WireRecord partition(int partition) {
        byte[] valueBytes = serialize(name, value, valueSerializer);
        return new WireRecord(name, null, valueBytes, partition, recordHeaders);
      }

      @Override
      public WireRecord key(K key, Serializer<? super K> keySerializer) {
        byte[] keyBytes = serialize(name, key, keySerializer);
        byte[] valueBytes = serialize(name, value, valueSerializer);
        return new WireRecord(name, keyBytes, valueBytes, null, recordHeaders);
      }
    });
  }

  private static <T> byte[] serialize(String topic, T value, Serializer<? super T> serializer) {
    try {
      return serializer.serialize(topic, value);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.serializationFailed(topic, ex);
    } catch (Exception ex) {
      throw Problems.serializationFailed(topic, ex);
    }
  }
}
