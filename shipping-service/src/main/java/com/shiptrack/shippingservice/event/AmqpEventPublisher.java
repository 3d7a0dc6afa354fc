package com.shiptrack.shippingservice.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiptrack.shippingservice.config.ShippingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Sends JSON events to the shipping topic exchange.
 *
 * The connection is owned by the CachingConnectionFactory behind the RabbitTemplate: it is
 * opened lazily on the first publish and re-opened on demand once the broker closes it.
 * The order event listener shares that connection, so a failed publish never closes it;
 * only the failed channel is discarded. Channels are handed out per thread, so concurrent
 * callers never share one. A batch is sent on a single scoped channel via
 * {@link RabbitTemplate#invoke}.
 *
 * Errors never propagate as exceptions: the triggering state change is already committed,
 * so the outcome is returned and the caller decides whether to retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AmqpEventPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final ObjectMapper objectMapper;
    private final ShippingProperties properties;

    public PublishResult publish(String routingKey, Object payload) {
        return publishAll(List.of(new OutboundEvent(routingKey, payload)));
    }

    public PublishResult publishAll(List<OutboundEvent> events) {
        if (!properties.getMessaging().isEnabled()) {
            log.info("RabbitMQ disabled, skipping events: {}", routingKeys(events));
            return PublishResult.skipped();
        }
        if (events.isEmpty()) {
            return PublishResult.published(0);
        }

        List<Message> messages = new ArrayList<>(events.size());
        try {
            for (OutboundEvent event : events) {
                messages.add(toMessage(event.getPayload()));
            }
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize events {}: {}", routingKeys(events), e.getMessage());
            return PublishResult.publishError(e.getMessage());
        }

        String exchange = properties.getMessaging().getExchange();
        try {
            rabbitTemplate.invoke(operations -> {
                for (int i = 0; i < events.size(); i++) {
                    operations.send(exchange, events.get(i).getRoutingKey(), messages.get(i));
                }
                return null;
            });
        } catch (AmqpConnectException e) {
            log.error("Cannot publish {}: RabbitMQ connection failed: {}", routingKeys(events), e.getMessage());
            return PublishResult.connectionError(e.getMessage());
        } catch (AmqpException e) {
            log.error("Failed to publish {}: {}", routingKeys(events), e.getMessage());
            return PublishResult.publishError(e.getMessage());
        }

        events.forEach(event -> log.info("Published event: {}", event.getRoutingKey()));
        return PublishResult.published(events.size());
    }

    private Message toMessage(Object payload) throws JsonProcessingException {
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setContentEncoding(StandardCharsets.UTF_8.name());
        props.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        props.setMessageId(UUID.randomUUID().toString());
        props.setTimestamp(new Date());
        // No __TypeId__ header: consumers read raw JSON
        return new Message(objectMapper.writeValueAsBytes(payload), props);
    }

    private static List<String> routingKeys(List<OutboundEvent> events) {
        return events.stream().map(OutboundEvent::getRoutingKey).toList();
    }
}
