package com.batchbridge.config;

import com.batchbridge.domain.service.ingestion.PayloadParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ConsumerRecordRecoverer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.DelegatingByTypeSerializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.springframework.util.backoff.ExponentialBackOff;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Listener container for ingest events.
 *
 * Offsets are committed by the listener (MANUAL ack). A listener exception
 * leaves the offset uncommitted; the error handler seeks back and redelivers
 * with exponential backoff until the redelivery budget is spent, then routes
 * the record to the dead letter topic and commits past it. Records that
 * cannot be deserialized, and failures that a redelivery cannot change, skip
 * the retries and go straight to the dead letter topic.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Bean(name = "ingestListenerContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<Object, Object> ingestListenerContainerFactory(
            ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
            ConsumerFactory<Object, Object> consumerFactory,
            KafkaProperties kafkaProperties,
            @Value("${app.kafka.topics.ingest-dlq}") String dlqTopic,
            @Value("${app.kafka.consumer.concurrency:3}") int concurrency,
            @Value("${app.kafka.consumer.redelivery-initial-interval-ms:1000}") long initialInterval,
            @Value("${app.kafka.consumer.redelivery-max-interval-ms:60000}") long maxInterval,
            @Value("${app.kafka.consumer.redelivery-max-elapsed-ms:900000}") long maxElapsed) {

        ConcurrentKafkaListenerContainerFactory<Object, Object> factory = new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(factory, consumerFactory);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        factory.setConcurrency(concurrency);

        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(deadLetterTemplate(kafkaProperties),
                (record, ex) -> {
                    log.error("Routing record partition={} offset={} to {}: {}",
                            record.partition(), record.offset(), dlqTopic, ex.getMessage());
                    return new TopicPartition(dlqTopic, -1);
                });

        DefaultErrorHandler errorHandler = ingestErrorHandler(recoverer, initialInterval, maxInterval, maxElapsed);
        errorHandler.setCommitRecovered(true);
        factory.setCommonErrorHandler(errorHandler);

        return factory;
    }

    static ExponentialBackOff redeliveryBackOff(long initialInterval, long maxInterval, long maxElapsed) {
        ExponentialBackOff backOff = new ExponentialBackOff(initialInterval, 2.0);
        backOff.setMaxInterval(maxInterval);
        backOff.setMaxElapsedTime(maxElapsed);
        return backOff;
    }

    static DefaultErrorHandler ingestErrorHandler(ConsumerRecordRecoverer recoverer,
                                                  long initialInterval, long maxInterval, long maxElapsed) {
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer,
                redeliveryBackOff(initialInterval, maxInterval, maxElapsed));
        // Same input, same failure: redelivery only repeats the job
        errorHandler.addNotRetryableExceptions(
                PayloadParseException.class,
                ArithmeticException.class,
                IllegalArgumentException.class,
                NullPointerException.class);
        return errorHandler;
    }

    /**
     * Template for dead letters only. Values that failed deserialization
     * arrive as the original bytes and are forwarded untouched; anything else
     * is written as JSON like the main producer does.
     */
    private static KafkaTemplate<String, Object> deadLetterTemplate(KafkaProperties kafkaProperties) {
        Map<String, Object> config = kafkaProperties.buildProducerProperties(null);
        config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        DefaultKafkaProducerFactory<String, Object> producerFactory = new DefaultKafkaProducerFactory<>(
                config, new StringSerializer(), deadLetterValueSerializer());
        return new KafkaTemplate<>(producerFactory);
    }

    static DelegatingByTypeSerializer deadLetterValueSerializer() {
        Map<Class<?>, Serializer<?>> delegates = new LinkedHashMap<>();
        delegates.put(byte[].class, new ByteArraySerializer());
        delegates.put(Object.class, new JsonSerializer<>().noTypeInfo());
        return new DelegatingByTypeSerializer(delegates, true);
    }
}
