package ca.gc.cra.beacon.adapter.kafka;

import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Test helper for constructing Kafka {@link MockProducer} instances.
 */
final class MockProducerFactory {
  private static final Partitioner NO_OP_PARTITIONER = new Partitioner() {
    @Override
    public void configure(Map<String, ?> configs) {
      // no configuration required for deterministic partitioning.
    }

    @Override
    public int partition(
        String topic,
        Object key,
        byte[] keyBytes,
        Object value,
        byte[] valueBytes,
        Cluster cluster) {
      return 0;
    }

    @Override
    public void close() {
      // nothing to release.
    }
  };

  private MockProducerFactory() {}

  static MockProducer<String, String> stringProducer() {
    return new MockProducer<>(true, NO_OP_PARTITIONER, new StringSerializer(), new StringSerializer());
  }

  /** Producer whose metadata lookup fails, as when no broker is reachable within max.block.ms. */
  static MockProducer<String, String> unreachableProducer(RuntimeException failure) {
    return new MockProducer<>(true, NO_OP_PARTITIONER, new StringSerializer(), new StringSerializer()) {
      @Override
      public synchronized List<PartitionInfo> partitionsFor(String topic) {
        throw failure;
      }
    };
  }
}
