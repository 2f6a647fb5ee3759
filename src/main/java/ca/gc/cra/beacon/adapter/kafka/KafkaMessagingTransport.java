package ca.gc.cra.beacon.adapter.kafka;

import ca.gc.cra.beacon.application.port.Subsystem;
import ca.gc.cra.beacon.config.ServiceConfig.MessagingSettings;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outbound messaging transport backed by a Kafka {@link Producer}.
 * <p>The producer is created during {@link #init()} and connectivity is verified by fetching partition metadata for
 * the configured topic. {@link #release()} flushes buffered records and closes the producer.</p>
 *
 * @implNote Records are enqueued asynchronously; {@link #send(String, String)} exposes the broker acknowledgement as
 * a {@link CompletableFuture}.
 * @since 0.1.0
 */
public final class KafkaMessagingTransport implements Subsystem {
  private static final Logger log = LoggerFactory.getLogger(KafkaMessagingTransport.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Supplier<Producer<String, String>> producerFactory;
  private final String topic;
  private final Executor executor;
  private final AtomicReference<Producer<String, String>> producer = new AtomicReference<>();

  /**
   * Creates a transport that builds a {@link KafkaProducer} from {@code settings}.
   *
   * @param settings messaging settings; bootstrap servers must be validated
   * @param executor executor running the blocking init and release work
   */
  public KafkaMessagingTransport(MessagingSettings settings, Executor executor) {
    this(() -> createProducer(settings), settings.topic(), executor);
  }

  KafkaMessagingTransport(Supplier<Producer<String, String>> producerFactory, String topic, Executor executor) {
    this.producerFactory = Objects.requireNonNull(producerFactory, "producerFactory");
    this.topic = Objects.requireNonNull(topic, "topic");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public String name() {
    return "messaging";
  }

  @Override
  public CompletableFuture<Void> init() {
    return CompletableFuture.runAsync(this::connect, executor);
  }

  /**
   * Publishes one record on the configured topic.
   *
   * @param key record key; may be {@code null}
   * @param value record payload
   * @return future completing with the broker acknowledgement
   * @throws IllegalStateException if the transport is not initialized
   */
  public CompletableFuture<RecordMetadata> send(String key, String value) {
    Producer<String, String> active = producer.get();
    if (active == null) {
      throw new IllegalStateException("messaging transport is not initialized");
    }
    CompletableFuture<RecordMetadata> result = new CompletableFuture<>();
    active.send(new ProducerRecord<>(topic, key, value), (metadata, ex) -> {
      if (ex != null) {
        result.completeExceptionally(ex);
      } else {
        result.complete(metadata);
      }
    });
    return result;
  }

  @Override
  public CompletableFuture<Void> release() {
    Producer<String, String> active = producer.getAndSet(null);
    if (active == null) {
      return CompletableFuture.completedFuture(null);
    }
    return CompletableFuture.runAsync(() -> {
      active.flush();
      active.close(CLOSE_TIMEOUT);
      log.info("Kafka producer for topic {} closed", topic);
    }, executor);
  }

  private void connect() {
    Producer<String, String> created = producerFactory.get();
    try {
      List<PartitionInfo> partitions = created.partitionsFor(topic);
      int count = partitions == null ? 0 : partitions.size();
      log.info("Kafka producer connected; topic {} has {} partition(s)", topic, count);
    } catch (RuntimeException ex) {
      closeQuietly(created, ex);
      throw ex;
    }
    if (!producer.compareAndSet(null, created)) {
      IllegalStateException duplicate = new IllegalStateException("messaging transport already initialized");
      closeQuietly(created, duplicate);
      throw duplicate;
    }
  }

  private static void closeQuietly(Producer<String, String> created, RuntimeException primary) {
    try {
      created.close(Duration.ZERO);
    } catch (RuntimeException closeEx) {
      primary.addSuppressed(closeEx);
    }
  }

  private static Producer<String, String> createProducer(MessagingSettings settings) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, settings.bootstrap());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, settings.maxBlockMs());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
