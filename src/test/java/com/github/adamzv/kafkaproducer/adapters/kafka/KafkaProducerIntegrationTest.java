package com.github.adamzv.kafkaproducer.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.kafkaproducer.domain.Headers;
import com.github.adamzv.kafkaproducer.domain.ProduceTarget;
import com.github.adamzv.kafkaproducer.domain.RecordMetadata;
import com.github.adamzv.kafkaproducer.domain.Serializer;
import com.github.adamzv.kafkaproducer.domain.Topic;
import com.github.adamzv.kafkaproducer.support.ProducerConfig;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers(disabledWithoutDocker = true)
@Tag("integration")
class KafkaProducerIntegrationTest {

  private static final DockerImageName KAFKA_IMAGE = DockerImageName.parse("confluentinc/cp-kafka:7.5.0");

  @Container
  static final KafkaContainer KAFKA = new KafkaContainer(KAFKA_IMAGE)
      .withReuse(false);

  private static ExecutorService blockingExecutor;

  @BeforeAll
  static void setUp() {
    blockingExecutor = Executors.newCachedThreadPool();
  }

  @AfterAll
  static void tearDown() {
    if (blockingExecutor != null) {
      blockingExecutor.shutdownNow();
    }
  }

  @Test
  void producesKeyedRecordWithHeaders() throws Exception {
    String topicName = "integration-orders";
    createTopic(topicName, 3);
    Topic<String, String> topic = Topic.of(topicName);
    ProducerConfig config = ProducerConfig.of(KAFKA.getBootstrapServers());

    RecordMetadata metadata = KafkaProducerScope
        .use(config, KafkaClientFactory.standard(), blockingExecutor,
            port -> port.produce(
                topic,
                "hello integration",
                Serializer.utf8(),
                ProduceTarget.key("order-1", Serializer.utf8()),
                Headers.EMPTY.withString("trace-id", "itest")))
        .get(30, TimeUnit.SECONDS);

    assertEquals(topicName, metadata.topic());
    assertTrue(metadata.offset() >= 0);

    ConsumerRecord<String, String> record = readOne(new TopicPartition(topicName, metadata.partition()), metadata.offset());
    assertEquals("order-1", record.key());
    assertEquals("hello integration", record.value());
    assertArrayEquals(
        "itest".getBytes(StandardCharsets.UTF_8),
        record.headers().lastHeader("trace-id").value()
    );
  }

  @Test
  void explicitPartitionIsHonoured() throws Exception {
    String topicName = "integration-partitioned";
    createTopic(topicName, 3);
    Topic<String, String> topic = Topic.of(topicName);
    ProducerConfig config = ProducerConfig.of(KAFKA.getBootstrapServers());

    RecordMetadata metadata = KafkaProducerScope
        .use(config, KafkaClientFactory.standard(), blockingExecutor,
            port -> port.produce(topic, "to-partition-2", Serializer.utf8(), ProduceTarget.partition(2)))
        .get(30, TimeUnit.SECONDS);

    assertEquals(2, metadata.partition());
  }

  private static void createTopic(String name, int partitions) throws Exception {
    Properties props = new Properties();
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
    try (AdminClient adminClient = AdminClient.create(props)) {
      adminClient.createTopics(List.of(new NewTopic(name, partitions, (short) 1)))
          .all()
          .get(10, TimeUnit.SECONDS);
    }
  }

  private static ConsumerRecord<String, String> readOne(TopicPartition partition, long offset) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);

    try (KafkaConsumer<String, String> consumer = new KafkaConsumer<>(props)) {
      consumer.assign(List.of(partition));
      consumer.seek(partition, offset);
      List<ConsumerRecord<String, String>> records = new ArrayList<>();
      long deadline = System.currentTimeMillis() + 10_000;
      while (records.isEmpty() && System.currentTimeMillis() < deadline) {
        consumer.poll(Duration.ofMillis(500)).forEach(records::add);
      }
      assertTrue(!records.isEmpty(), "Expected the produced record to be readable");
      return records.get(0);
    }
  }
}
