package com.qnet.loadbalancer.kafka;

import com.qnet.core.alert.Alert;
import com.qnet.core.msg.Topics;
import com.qnet.core.util.JsonUtils;
import com.qnet.loadbalancer.config.LBConfig;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka-backed {@link IAlertPublisher}.
 * <p>
 * Alerts are keyed by their source node so that one node's alerts stay ordered within a
 * partition; failover events are keyed by the failed node.
 * </p>
 */
public class KafkaAlertPublisher implements IAlertPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaAlertPublisher.class);

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;

    public KafkaAlertPublisher(LBConfig config) {
        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.CLIENT_ID_CONFIG, config.getNodeId() + "-alerts");
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        createTopicIfNotExists(Topics.CONTROL_ALERTS, 4, (short) 1)
            .then(createTopicIfNotExists(Topics.CONTROL_FAILOVER, 1, (short) 1))
            .subscribe(
                null,
                error -> log.error("Kafka topic setup failed, publishing will retry on send", error)
            );
        log.info("Kafka alert publisher initialized (bootstrap={})", config.getKafkaBootstrap());
    }

    @Override
    public Mono<Void> publishAlert(Alert alert) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            Topics.CONTROL_ALERTS,
            alert.getSource(),
            JsonUtils.writeValueAsString(alert)
        );

        return sender.send(Mono.just(SenderRecord.create(record, alert.getId())))
            .next()
            .doOnSuccess(result -> log.debug("Published alert {} ({}/{})",
                alert.getId(), alert.getCategory(), alert.getSeverity()))
            .doOnError(err -> log.error("Failed to publish alert {}", alert.getId(), err))
            .then();
    }

    @Override
    public Mono<Void> publishFailover(FailoverEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            Topics.CONTROL_FAILOVER,
            event.getFailedNodeId(),
            JsonUtils.writeValueAsString(event)
        );

        return sender.send(Mono.just(SenderRecord.create(record, event.getFailedNodeId())))
            .next()
            .doOnSuccess(result -> log.info("Published failover event: failedNodeId={}, success={}",
                event.getFailedNodeId(), event.getResult().isSuccess()))
            .doOnError(err -> log.error("Failed to publish failover event for {}", event.getFailedNodeId(), err))
            .then();
    }

    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    NewTopic newTopic = new NewTopic(topicName, partitions, replicationFactor);

                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(newTopic))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage());
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public void close() {
        sender.close();
        adminClient.close(Duration.ofSeconds(5));
        log.info("Kafka alert publisher closed");
    }
}
