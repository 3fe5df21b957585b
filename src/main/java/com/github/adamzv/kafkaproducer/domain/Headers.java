package com.github.adamzv.kafkaproducer.domain;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

public final class Headers {

  public static final Headers EMPTY = new Headers(Map.of());

  private final Map<String, byte[]> values;

  private Headers(Map<String, byte[]> values) {
    this.values = values;
  }

  public static Headers of(Map<String, byte[]> values) {
    if (values == null || values.isEmpty()) {
      return EMPTY;
    }
    Headers headers = EMPTY;
    for (Map.Entry<String, byte[]> entry : values.entrySet()) {
      headers = headers.with(entry.getKey(), entry.getValue());
    }
    return headers;
  }

  public Headers with(String name, byte[] value) {
    if (name == null || name.isBlank()) {
      throw Problems.invalidArgument("Header names must not be blank", Map.of());
    }
    Map<String, byte[]> copy = new LinkedHashMap<>(values);
    copy.put(name, value == null ? new byte[0] : value.clone());
    return new Headers(Collections.unmodifiableMap(copy));
  }

  public Headers withString(String name, String value) {
    return with(name, value == null ? null : value.getBytes(StandardCharsets.UTF_8));
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public int size() {
    return values.size();
  }

  public byte[] get(String name) {
    byte[] value = values.get(name);
    return value == null ? null : value.clone();
  }

  public void forEach(BiConsumer<String, byte[]> action) {
    values.forEach((name, value) -> action.accept(name, value.clone()));
  }

  public Map<String, byte[]> asMap() {
    Map<String, byte[]> copy = new LinkedHashMap<>();
    values.forEach((name, value) -> copy.put(name, value.clone()));
    return Collections.unmodifiableMap(copy);
  }

  @Override
  public String toString() {
    return "Headers" + values.keySet();
  }
}
