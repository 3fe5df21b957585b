package com.github.adamzv.kafkaproducer.domain;

import java.util.Map;

public record Topic<K, V>(String name) {

  public Topic {
    if (name == null || name.isBlank()) {
      throw Problems.invalidArgument("Topic must not be blank", Map.of());
    }
  }

  public static <K, V> Topic<K, V> of(String name) {
    return new Topic<>(name);
  }
}
