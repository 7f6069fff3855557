package com.wellsfargo.compliance.engine.publish;

import com.wellsfargo.compliance.canonical.ComplianceResult;
import com.wellsfargo.compliance.engine.queue.ComplianceResultListener;
import com.wellsfargo.compliance.kafka.ComplianceResultSerializer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Properties;

/**
 * Publishes completed compliance results to Kafka.
 *
 * Results are JSON-encoded with {@link ComplianceResultSerializer} and keyed
 * by record identifier, so all results of one record land on one partition.
 * Only active when {@code compliance.kafka.enabled=true}.
 *
 * Publishing is fire-and-forget: a failed send is logged and never affects
 * the job that produced the result.
 */
@Component
@ConditionalOnProperty(name = "compliance.kafka.enabled", havingValue = "true")
public class KafkaComplianceResultPublisher implements ComplianceResultListener {

    private static final Logger log = LoggerFactory.getLogger(KafkaComplianceResultPublisher.class);

    public static final String DEFAULT_TOPIC = "compliance.results";

    private final String bootstrapServers;
    private final String topic;
    private Producer<String, ComplianceResult> producer;

    @Autowired
    public KafkaComplianceResultPublisher(@Value("${kafka.bootstrap.servers:localhost:9092}") String bootstrapServers,
                                          @Value("${compliance.kafka.topic:" + DEFAULT_TOPIC + "}") String topic) {
        this.bootstrapServers = bootstrapServers;
        this.topic = topic;
    }

    public KafkaComplianceResultPublisher(Producer<String, ComplianceResult> producer, String topic) {
        this.bootstrapServers = null;
        this.topic = topic;
        this.producer = producer;
    }

    @PostConstruct
    public void init() {
        if (producer != null) {
            return;
        }
        log.info("Initializing compliance result publisher: bootstrapServers={}, topic={}", bootstrapServers, topic);

        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ComplianceResultSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, 16384);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 10);

        producer = new KafkaProducer<>(props);
    }

    @Override
    public void onComplianceResult(String jobId, ComplianceResult result) {
        ProducerRecord<String, ComplianceResult> record = new ProducerRecord<>(topic, result.getRecordId(), result);
        producer.send(record, (metadata, exception) -> {
            if (exception != null) {
                log.error("Failed to publish result of job {} (record {}) to {}", jobId, result.getRecordId(), topic,
                    exception);
            } else {
                log.debug("Published result of job {} to {} partition {} offset {}", jobId, metadata.topic(),
                    metadata.partition(), metadata.offset());
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        if (producer != null) {
            log.info("Closing compliance result publisher");
            producer.close(Duration.ofSeconds(5));
        }
    }

    public String getTopic() {
        return topic;
    }
}
