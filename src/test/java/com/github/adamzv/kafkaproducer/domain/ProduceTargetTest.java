package com.github.adamzv.kafkaproducer.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ProduceTargetTest {

  private static final ProduceTarget.Visitor<String, String> DESCRIBE = new ProduceTarget.Visitor<>() {
    @Override
    public String none() {
      return "none";
    }

    @Override
    public String partition(int partition) {
      return "partition:" + partition;
    }

    @Override
    public String key(String key, Serializer<? super String> serializer) {
      return "key:" + key;
    }
  };

  @Test
  void dispatchesEachVariant() {
    assertEquals("none", ProduceTarget.<String>none().accept(DESCRIBE));
    assertEquals("partition:4", ProduceTarget.<String>partition(4).accept(DESCRIBE));
    assertEquals("key:k1", ProduceTarget.key("k1", Serializer.utf8()).accept(DESCRIBE));
  }

  @Test
  void noneTargetsAreEqual() {
    assertEquals(ProduceTarget.<String>none(), ProduceTarget.<String>none());
  }

  @Test
  void rejectsNegativePartition() {
    ProblemException exception = assertThrows(ProblemException.class, () -> ProduceTarget.partition(-1));
    assertEquals(ProblemCodes.INVALID_ARGUMENT, exception.problem().code());
  }

  @Test
  void rejectsBlankTopicName() {
    ProblemException exception = assertThrows(ProblemException.class, () -> Topic.of(""));
    assertEquals(ProblemCodes.INVALID_ARGUMENT, exception.problem().code());
  }
}
