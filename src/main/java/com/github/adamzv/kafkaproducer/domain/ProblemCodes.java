package com.github.adamzv.kafkaproducer.domain;

public final class ProblemCodes {
  public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
  public static final String SETUP_FAILED = "SETUP_FAILED";
  public static final String SERIALIZATION_FAILED = "SERIALIZATION_FAILED";
  public static final String DISPATCH_FAILED = "DISPATCH_FAILED";
  public static final String PRODUCER_CLOSED = "PRODUCER_CLOSED";

  private ProblemCodes() {
  }
}
