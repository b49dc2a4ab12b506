package com.safejob.matching.async;

import com.safejob.matching.dto.events.MatchingEvent;
import com.safejob.matching.utils.basic.BasicUtility;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Publishes engine events to Kafka. Fire-and-forget: a failed send is counted, routed to the
 * dead-letter topic and logged, but never surfaces to the caller.
 */
@Slf4j
@Component
public class MatchingEventProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final Executor kafkaCallbackExecutor;
    private final Map<String, String> topics;
    private final String dlqTopic;

    public MatchingEventProducer(
            KafkaTemplate<String, String> kafkaTemplate,
            MeterRegistry meterRegistry,
            @Qualifier("kafkaCallbackExecutor") Executor kafkaCallbackExecutor,
            @Value("${matching.topics.application-submitted:application-submitted}") String applicationSubmittedTopic,
            @Value("${matching.topics.application-status-changed:application-status-changed}") String statusChangedTopic,
            @Value("${matching.topics.couple-awaiting-partner:couple-awaiting-partner}") String awaitingPartnerTopic,
            @Value("${matching.topics.couple-application-resolved:couple-application-resolved}") String coupleResolvedTopic,
            @Value("${matching.topics.match-computed:match-computed}") String matchComputedTopic,
            @Value("${matching.topics.dlq:matching-engine-dlq}") String dlqTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.meterRegistry = meterRegistry;
        this.kafkaCallbackExecutor = kafkaCallbackExecutor;
        this.topics = Map.of(
                "ApplicationSubmitted", applicationSubmittedTopic,
                "ApplicationStatusChanged", statusChangedTopic,
                "CoupleAwaitingPartner", awaitingPartnerTopic,
                "CoupleApplicationResolved", coupleResolvedTopic,
                "MatchComputed", matchComputedTopic);
        this.dlqTopic = dlqTopic;
    }

    /**
     * Defers the send until the surrounding transaction commits, so consumers never see an event
     * for a write that was rolled back. Sends immediately when no transaction is active.
     */
    public void publishAfterCommit(MatchingEvent event) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publish(event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publish(event);
            }
        });
    }

    public void publish(MatchingEvent event) {
        String topic = topics.get(event.eventType());
        if (topic == null) {
            log.error("No topic configured for event type {}", event.eventType());
            meterRegistry.counter("kafka_send_failures", "topic", "unknown", "type", event.eventType()).increment();
            return;
        }

        String payload;
        try {
            payload = BasicUtility.stringifyObject(event);
        } catch (RuntimeException e) {
            log.error("Failed to serialise {} key={}: {}", event.eventType(), event.key(), e.getMessage(), e);
            meterRegistry.counter("kafka_send_failures", "topic", topic, "type", event.eventType()).increment();
            return;
        }
        sendMessage(topic, event.key(), payload, event.eventType());
    }

    private void sendMessage(String topic, String key, String value, String type) {
        long startTime = System.nanoTime();
        try {
            kafkaTemplate.send(topic, key, value)
                    .whenCompleteAsync((result, ex) -> {
                        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
                        if (ex == null) {
                            log.debug("Sent {} to {}: key={}, duration={} ms", type, topic, key, durationMs);
                            meterRegistry.timer("kafka_send_duration", "topic", topic, "type", type)
                                    .record(durationMs, TimeUnit.MILLISECONDS);
                        } else {
                            log.error("Failed to send {} to {}: key={}, error={}", type, topic, key, ex.getMessage(), ex);
                            meterRegistry.counter("kafka_send_failures", "topic", topic, "type", type).increment();
                            sendToDlq(key, value, type);
                        }
                    }, kafkaCallbackExecutor);
        } catch (RuntimeException e) {
            log.error("Kafka send rejected for {} key={}: {}", type, key, e.getMessage(), e);
            meterRegistry.counter("kafka_send_failures", "topic", topic, "type", type).increment();
        }
    }

    private void sendToDlq(String key, String value, String type) {
        kafkaTemplate.send(dlqTopic, key, value)
                .whenCompleteAsync((result, ex) -> {
                    if (ex == null) {
                        log.info("Sent {} to DLQ: key={}", type, key);
                    } else {
                        log.error("Failed to send {} to DLQ: key={}, error={}", type, key, ex.getMessage(), ex);
                        meterRegistry.counter("kafka_dlq_send_failures", "type", type).increment();
                    }
                }, kafkaCallbackExecutor);
    }
}
