package com.github.adamzv.kafkaproducer.adapters.kafka;

import com.github.adamzv.kafkaproducer.ports.KafkaProducerPort;
import com.github.adamzv.kafkaproducer.support.ProducerConfig;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Acquires a producer on a blocking executor, lends it to a body and closes it when the body's
 * future settles. The producer is closed on success, failure, a body that throws, and
 * cancellation of the returned future.
 */
public final class KafkaProducerScope {

  private static final Logger log = LoggerFactory.getLogger(KafkaProducerScope.class);

  private KafkaProducerScope() {
  }

  public static CompletableFuture<KafkaProducerAdapter> acquire(
      ProducerConfig config,
      KafkaClientFactory clientFactory,
      Executor blockingExecutor) {
    return CompletableFuture.supplyAsync(() -> KafkaProducerAdapter.open(config, clientFactory), blockingExecutor);
  }

  public static CompletableFuture<Void> release(KafkaProducerAdapter adapter, Executor blockingExecutor) {
    return CompletableFuture.runAsync(adapter::close, blockingExecutor);
  }

  public static <T> CompletableFuture<T> use(
      ProducerConfig config,
      KafkaClientFactory clientFactory,
      Executor blockingExecutor,
      Function<? super KafkaProducerPort, ? extends CompletionStage<T>> body) {
    CompletableFuture<T> result = new CompletableFuture<>();
    acquire(config, clientFactory, blockingExecutor).whenComplete((adapter, setupError) -> {
      if (setupError != null) {
        result.completeExceptionally(setupError);
        return;
      }
      if (result.isDone()) {
        releaseThen(adapter, blockingExecutor, () -> { });
        return;
      }
      CompletableFuture<T> outcome = run(body, adapter);
      result.whenComplete((value, error) -> {
        if (result.isCancelled()) {
          outcome.cancel(false);
        }
      });
      outcome.whenComplete((value, error) ->
          releaseThen(adapter, blockingExecutor, () -> {
            if (error != null) {
              result.completeExceptionally(error);
            } else {
              result.complete(value);
            }
          }));
    });
    return result;
  }

  private static void releaseThen(KafkaProducerAdapter adapter, Executor blockingExecutor, Runnable next) {
    CompletableFuture<Void> released;
    try {
      released = release(adapter, blockingExecutor);
    } catch (RejectedExecutionException ex) {
      log.warn("producer_release outcome=rejected error={}", ex.getClass().getSimpleName());
      adapter.close();
      next.run();
      return;
    }
    released.whenComplete((ignored, releaseError) -> {
      if (releaseError != null) {
        log.warn("producer_release outcome=error error={}", releaseError.getClass().getSimpleName(), releaseError);
      }
      next.run();
    });
  }

  private static <T> CompletableFuture<T> run(
      Function<? super KafkaProducerPort, ? extends CompletionStage<T>> body,
      KafkaProducerAdapter adapter) {
    try {
      CompletionStage<T> stage = body.apply(adapter);
      if (stage == null) {
        return CompletableFuture.completedFuture(null);
      }
      return stage.toCompletableFuture();
    } catch (RuntimeException ex) {
      return CompletableFuture.failedFuture(ex);
    }
  }
}
