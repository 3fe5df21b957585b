package com.github.adamzv.kafkaproducer.domain;

public final class DispatchError extends ProducerError {

  public DispatchError(Problem problem, Throwable cause) {
    super(problem, cause);
  }
}
