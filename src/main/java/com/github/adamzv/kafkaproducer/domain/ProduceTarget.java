package com.github.adamzv.kafkaproducer.domain;

import java.util.Map;
import java.util.Objects;

public sealed interface ProduceTarget<K> {

  <R> R accept(Visitor<K, R> visitor);

  static <K> ProduceTarget<K> none() {
    return new None<>();
  }

  static <K> ProduceTarget<K> partition(int partition) {
    return new Partition<>(partition);
  }

  static <K> ProduceTarget<K> key(K key, Serializer<? super K> serializer) {
    return new Key<>(key, serializer);
  }

  interface Visitor<K, R> {

    R none();

    R partition(int partition);

    R key(K key, Serializer<? super K> serializer);
  }

  record None<K>() implements ProduceTarget<K> {

    @Override
    public <R> R accept(Visitor<K, R> visitor) {
      return visitor.none();
    }
  }

  record Partition<K>(int partition) implements ProduceTarget<K> {

    public Partition {
      if (partition < 0) {
        throw Problems.invalidArgument("Partition must not be negative", Map.of("partition", partition));
      }
    }

    @Override
    public <R> R accept(Visitor<K, R> visitor) {
      return visitor.partition(partition);
    }
  }

  record Key<K>(K key, Serializer<? super K> serializer) implements ProduceTarget<K> {

    public Key {
      Objects.requireNonNull(serializer, "serializer");
    }

    @Override
    public <R> R accept(Visitor<K, R> visitor) {
      return visitor.key(key, serializer);
    }
  }
}
