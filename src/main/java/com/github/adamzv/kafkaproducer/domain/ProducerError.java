package com.github.adamzv.kafkaproducer.domain;

public abstract sealed class ProducerError extends ProblemException
    permits SerializationError, DispatchError {

  protected ProducerError(Problem problem, Throwable cause) {
    super(problem, cause);
  }
}
