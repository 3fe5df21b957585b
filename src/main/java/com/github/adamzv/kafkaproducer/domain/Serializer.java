package com.github.adamzv.kafkaproducer.domain;

import java.nio.charset.StandardCharsets;

@FunctionalInterface
public interface Serializer<T> {

  byte[] serialize(String topic, T value) throws Exception;

  static Serializer<String> utf8() {
    return (topic, value) -> value == null ? null : value.getBytes(StandardCharsets.UTF_8);
  }

  static Serializer<byte[]> byteArray() {
    return (topic, value) -> value;
  }
}
