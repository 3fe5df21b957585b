package com.github.adamzv.kafkaproducer.domain;

public record RecordMetadata(
    String topic,
    int partition,
    long offset,
    long timestamp
) {}
