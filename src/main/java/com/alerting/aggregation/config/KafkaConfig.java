package com.alerting.aggregation.config;

import com.alerting.aggregation.messaging.EventLifecycleMessage;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka consumer config for event lifecycle notifications ({@link EventLifecycleMessage}).
 * JSON payloads; a record that cannot be deserialized is logged and skipped.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${alerting.kafka.consumer-group:alert-aggregation-engine}")
    private String consumerGroup;

    /** Shared JSON mapper: Kafka payloads, event attribute columns and the REST API. */
    @Bean(name = "alertingObjectMapper")
    public ObjectMapper alertingObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ConsumerFactory<String, EventLifecycleMessage> eventLifecycleConsumerFactory(
            @Qualifier("alertingObjectMapper") ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroup);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        JsonDeserializer<EventLifecycleMessage> deserializer = new JsonDeserializer<>(EventLifecycleMessage.class, objectMapper);
        deserializer.setUseTypeHeaders(false);
        deserializer.addTrustedPackages("com.alerting.aggregation");
        ErrorHandlingDeserializer<EventLifecycleMessage> errorHandlingDeserializer = new ErrorHandlingDeserializer<>(deserializer);
        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), errorHandlingDeserializer);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, EventLifecycleMessage> eventLifecycleListenerContainerFactory(
            ConsumerFactory<String, EventLifecycleMessage> eventLifecycleConsumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, EventLifecycleMessage> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(eventLifecycleConsumerFactory);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
        factory.setCommonErrorHandler(new DefaultErrorHandler(new FixedBackOff(0L, 0L)) {
            @Override
            public void handleOtherException(Exception thrownException, Consumer<?, ?> consumer,
                    MessageListenerContainer container, boolean batchListener) {
                Throwable cause = thrownException.getCause();
                if (cause != null) {
                    log.error("Lifecycle listener error: {} - {}", cause.getClass().getSimpleName(), cause.getMessage(), thrownException);
                } else {
                    log.error("Lifecycle listener error", thrownException);
                }
                super.handleOtherException(thrownException, consumer, container, batchListener);
            }
        });
        return factory;
    }
}
