package com.github.adamzv.kafkaproducer.adapters.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkaproducer.domain.Serializer;

public class JsonSerializer<T> implements Serializer<T> {

  private final ObjectMapper objectMapper;

  public JsonSerializer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public byte[] serialize(String topic, T value) throws JsonProcessingException {
    if (value == null) {
      return null;
    }
    return objectMapper.writeValueAsBytes(value);
  }
}
