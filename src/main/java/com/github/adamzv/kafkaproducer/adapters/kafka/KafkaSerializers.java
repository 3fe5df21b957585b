package com.github.adamzv.kafkaproducer.adapters.kafka;

import com.github.adamzv.kafkaproducer.domain.Serializer;
import java.util.Objects;
import org.apache.kafka.common.serialization.StringSerializer;

public final class KafkaSerializers {

  private KafkaSerializers() {
  }

  public static <T> Serializer<T> of(org.apache.kafka.common.serialization.Serializer<T> serializer) {
    Objects.requireNonNull(serializer, "serializer");
    return serializer::serialize;
  }

  public static Serializer<String> string() {
    return of(new StringSerializer());
  }
}
