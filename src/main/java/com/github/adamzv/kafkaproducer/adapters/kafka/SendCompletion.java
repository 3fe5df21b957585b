package com.github.adamzv.kafkaproducer.adapters.kafka;

import com.github.adamzv.kafkaproducer.domain.Problems;
import com.github.adamzv.kafkaproducer.domain.RecordMetadata;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges the Kafka send callback, which fires on the client's I/O thread, into a future.
 * Only the first resolution is applied.
 */
final class SendCompletion implements Callback {

  private static final Logger log = LoggerFactory.getLogger(SendCompletion.class);

  private final String topic;
  private final CompletableFuture<RecordMetadata> result = new CompletableFuture<>();

  SendCompletion(String topic) {
    this.topic = topic;
  }

  CompletableFuture<RecordMetadata> result() {
    return result;
  }

  @Override
  public void onCompletion(org.apache.kafka.clients.producer.RecordMetadata metadata, Exception exception) {
    if (exception != null) {
      fail(exception);
    } else {
      succeed(metadata);
    }
  }

  void fail(Throwable cause) {
    boolean applied = result.completeExceptionally(Problems.dispatchFailed(topic, cause));
    checkFirstResolution(applied, "error");
  }

  private void succeed(org.apache.kafka.clients.producer.RecordMetadata metadata) {
    boolean applied = result.complete(new RecordMetadata(
        metadata.topic(),
        metadata.partition(),
        metadata.offset(),
        metadata.timestamp()
    ));
    checkFirstResolution(applied, "success");
  }

  private void checkFirstResolution(boolean applied, String outcome) {
    if (applied) {
      return;
    }
    if (result.isCancelled()) {
      log.debug("produce_completion_ignored topic={} outcome={} reason=cancelled", topic, outcome);
    } else {
      log.warn("produce_completion_ignored topic={} outcome={} reason=already_resolved", topic, outcome);
    }
  }
}
