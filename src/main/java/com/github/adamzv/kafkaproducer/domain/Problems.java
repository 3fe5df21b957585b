package com.github.adamzv.kafkaproducer.domain;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public final class Problems {

  private Problems() {
  }

  public static ProblemException invalidArgument(String message, Map<String, Object> details) {
    return raise(ProblemCodes.INVALID_ARGUMENT, message, details);
  }

  public static ProblemException setupFailed(String bootstrapServers, Throwable cause) {
    return new ProblemException(
        new Problem(
            ProblemCodes.SETUP_FAILED,
            "Unable to create Kafka producer",
            errorDetails("bootstrapServers", bootstrapServers, cause)
        ),
        cause
    );
  }

  public static SerializationError serializationFailed(String topic, Throwable cause) {
    return new SerializationError(
        new Problem(
            ProblemCodes.SERIALIZATION_FAILED,
            "Record could not be serialized",
            errorDetails("topic", topic, cause)
        ),
        cause
    );
  }

  public static DispatchError dispatchFailed(String topic, Throwable cause) {
    return new DispatchError(
        new Problem(
            ProblemCodes.DISPATCH_FAILED,
            "Kafka produce failed",
            errorDetails("topic", topic, cause)
        ),
        cause
    );
  }

  public static ProblemException producerClosed(String topic) {
    return raise(ProblemCodes.PRODUCER_CLOSED, "Producer has been closed", Map.of("topic", topic));
  }

  private static ProblemException raise(String code, String message, Map<String, Object> details) {
    return new ProblemException(new Problem(code, message, details));
  }

  private static Map<String, Object> errorDetails(String contextKey, Object contextValue, Throwable cause) {
    Map<String, Object> details = new HashMap<>();
    details.put(contextKey, contextValue);
    if (cause != null) {
      details.put("error", cause.getClass().getSimpleName());
      if (cause.getMessage() != null) {
        details.put("message", cause.getMessage());
      }
    }
    return Collections.unmodifiableMap(details);
  }
}
