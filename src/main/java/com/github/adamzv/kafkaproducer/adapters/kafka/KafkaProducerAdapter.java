package com.github.adamzv.kafkaproducer.adapters.kafka;

import com.github.adamzv.kafkaproducer.application.WireRecordBuilder;
import com.github.adamzv.kafkaproducer.domain.Headers;
import com.github.adamzv.kafkaproducer.domain.ProduceTarget;
import com.github.adamzv.kafkaproducer.domain.Problems;
import com.github.adamzv.kafkaproducer.domain.RecordMetadata;
import com.github.adamzv.kafkaproducer.domain.SerializationError;
import com.github.adamzv.kafkaproducer.domain.Serializer;
import com.github.adamzv.kafkaproducer.domain.Topic;
import com.github.adamzv.kafkaproducer.domain.WireRecord;
import com.github.adamzv.kafkaproducer.ports.KafkaProducerPort;
import com.github.adamzv.kafkaproducer.support.ProducerConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaProducerAdapter implements KafkaProducerPort, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(KafkaProducerAdapter.class);

  private final Producer<byte[], byte[]> producer;
  private final ProducerConfig config;
  private final WireRecordBuilder recordBuilder;
  private final AtomicBoolean closed = new AtomicBoolean();

  public KafkaProducerAdapter(Producer<byte[], byte[]> producer, ProducerConfig config) {
    this.producer = producer;
    this.config = config;
    this.recordBuilder = new WireRecordBuilder();
  }

  public static KafkaProducerAdapter open(ProducerConfig config, KafkaClientFactory clientFactory) {
    Producer<byte[], byte[]> producer;
    try {
      producer = clientFactory.create(config);
    } catch (RuntimeException ex) {
      log.error(
          "producer_open outcome=error bootstrapServers={} error={}",
          config.bootstrapServersString(),
          ex.getClass().getSimpleName()
      );
      throw Problems.setupFailed(config.bootstrapServersString(), ex);
    }
    log.info("producer_open outcome=success bootstrapServers={}", config.bootstrapServersString());
    return new KafkaProducerAdapter(producer, config);
  }

  @Override
  public <K, V> CompletableFuture<RecordMetadata> produce(
      Topic<K, V> topic,
      V value,
      Serializer<? super V> valueSerializer,
      ProduceTarget<K> target,
      Headers headers) {
    if (topic == null) {
      return CompletableFuture.failedFuture(Problems.invalidArgument("Topic is required", Map.of()));
    }
    if (closed.get()) {
      return CompletableFuture.failedFuture(Problems.producerClosed(topic.name()));
    }

    WireRecord record;
    try {
      record = recordBuilder.build(topic, value, valueSerializer, target, headers);
    } catch (SerializationError ex) {
      return CompletableFuture.failedFuture(ex);
    }

    SendCompletion completion = new SendCompletion(record.topic());
    try {
      producer.send(toProducerRecord(record), completion);
    } catch (RuntimeException ex) {
      completion.fail(ex);
    }
    return completion.result();
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      producer.close(config.closeTimeout());
      log.info("producer_close outcome=success bootstrapServers={}", config.bootstrapServersString());
    } catch (RuntimeException ex) {
      log.warn(
          "producer_close outcome=error bootstrapServers={} error={} message={}",
          config.bootstrapServersString(),
          ex.getClass().getSimpleName(),
          ex.getMessage(),
          ex
      );
    }
  }

  private static ProducerRecord<byte[], byte[]> toProducerRecord(WireRecord record) {
    List<Header> headers = new ArrayList<>(record.headers().size());
    record.headers().forEach((name, value) -> headers.add(new RecordHeader(name, value)));
    return new ProducerRecord<>(
        record.topic(),
        record.partition(),
        record.key(),
        record.value(),
        headers
    );
  }
}
