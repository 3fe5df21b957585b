package com.github.adamzv.kafkaproducer.domain;

import java.util.Objects;

public record WireRecord(
    String topic,
    byte[] key,
    byte[] value,
    Integer partition,
    Headers headers
) {

  public WireRecord {
    Objects.requireNonNull(topic, "topic");
    headers = headers == null ? Headers.EMPTY : headers;
  }

  public boolean hasKey() {
    return key != null;
  }
}
