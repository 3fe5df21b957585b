package com.github.adamzv.kafkaproducer.domain;

public final class SerializationError extends ProducerError {

  public SerializationError(Problem problem, Throwable cause) {
    super(problem, cause);
  }
}
