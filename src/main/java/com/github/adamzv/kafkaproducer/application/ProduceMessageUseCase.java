package com.github.adamzv.kafkaproducer.application;

import com.github.adamzv.kafkaproducer.domain.Headers;
import com.github.adamzv.kafkaproducer.domain.Problem;
import com.github.adamzv.kafkaproducer.domain.ProblemException;
import com.github.adamzv.kafkaproducer.domain.ProduceTarget;
import com.github.adamzv.kafkaproducer.domain.RecordMetadata;
import com.github.adamzv.kafkaproducer.domain.Serializer;
import com.github.adamzv.kafkaproducer.domain.Topic;
import com.github.adamzv.kafkaproducer.ports.KafkaProducerPort;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ProduceMessageUseCase {

  private static final Logger log = LoggerFactory.getLogger(ProduceMessageUseCase.class);

  static final String DURATION_METRIC = "kafka_producer_produce_duration_seconds";
  static final String ERRORS_METRIC = "kafka_producer_errors_total";
  static final String UNKNOWN_CODE = "UNKNOWN";

  private final KafkaProducerPort producerPort;
  private final MeterRegistry meterRegistry;

  public ProduceMessageUseCase(KafkaProducerPort producerPort, MeterRegistry meterRegistry) {
    this.producerPort = producerPort;
    this.meterRegistry = meterRegistry;
  }

  public <K, V> CompletableFuture<RecordMetadata> execute(
      Topic<K, V> topic,
      V value,
      Serializer<? super V> valueSerializer,
      ProduceTarget<K> target,
      Headers headers) {
    String requestId = UUID.randomUUID().toString();
    Instant start = Instant.now();
    Timer.Sample sample = Timer.start(meterRegistry);
    String targetKind = describeTarget(target);

    CompletableFuture<RecordMetadata> result;
    try {
      result = producerPort.produce(topic, value, valueSerializer, target, headers);
    } catch (ProblemException ex) {
      result = CompletableFuture.failedFuture(ex);
    }

    return result.whenComplete((metadata, error) -> {
      Duration duration = Duration.between(start, Instant.now());
      if (error == null) {
        recordSuccess(topic.name(), sample);
        log.info(
            "produce outcome=success requestId={} topic={} target={} durationMs={} partition={} offset={}",
            requestId,
            topic.name(),
            targetKind,
            duration.toMillis(),
            metadata.partition(),
            metadata.offset()
        );
        return;
      }
      Problem problem = problemOf(error);
      String code = problem != null ? problem.code() : UNKNOWN_CODE;
      recordError(topic.name(), code, sample);
      log.warn(
          "produce outcome=error requestId={} topic={} target={} durationMs={} code={} message={}",
          requestId,
          topic.name(),
          targetKind,
          duration.toMillis(),
          code,
          problem != null ? problem.message() : unwrap(error).getMessage()
      );
    });
  }

  public <K, V> CompletableFuture<RecordMetadata> execute(
      Topic<K, V> topic,
      K key,
      V value,
      Serializer<? super K> keySerializer,
      Serializer<? super V> valueSerializer) {
    return execute(topic, value, valueSerializer, ProduceTarget.key(key, keySerializer), Headers.EMPTY);
  }

  static <K> String describeTarget(ProduceTarget<K> target) {
    if (target == null) {
      return "none";
    }
    return target.accept(new ProduceTarget.Visitor<K, String>() {
      @Override
      public String none() {
        return "none";
      }

      @Override
      public String partition(int partition) {
        return "partition=" + partition;
      }

      @Override
      public String key(K key, Serializer<? super K> serializer) {
        return "key";
      }
    });
  }

  private void recordSuccess(String topic, Timer.Sample sample) {
    sample.stop(meterRegistry.timer(DURATION_METRIC, "topic", topic, "outcome", "success"));
  }

  private void recordError(String topic, String code, Timer.Sample sample) {
    sample.stop(meterRegistry.timer(DURATION_METRIC, "topic", topic, "outcome", "error"));
    meterRegistry.counter(ERRORS_METRIC, "topic", topic, "code", code).increment();
  }

  private static Problem problemOf(Throwable error) {
    Throwable cause = unwrap(error);
    return cause instanceof ProblemException problemException ? problemException.problem() : null;
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
