package com.shiptrack.shippingservice.subscriber;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches inbound order events to their handler and decides how the message is settled.
 *
 * - Unknown routing key: ACK, so foreign events never block the queue
 * - Handler succeeded: ACK
 * - Handler threw (malformed payload, unexpected failure): NACK with requeue; the broker
 *   redelivers and the idempotent handlers absorb the repeat
 *
 * Outbound publication happens after commit and reports failures as values, so a broker
 * outage on the publishing side never turns a successful handler into a NACK.
 */
@Component
@Slf4j
public class InboundEventRouter {

    private final Map<InboundEventType, InboundEventHandler> handlers = new EnumMap<>(InboundEventType.class);

    public InboundEventRouter(List<InboundEventHandler> registeredHandlers) {
        for (InboundEventHandler handler : registeredHandlers) {
            if (handler.type() == InboundEventType.UNKNOWN) {
                throw new IllegalStateException("Handler cannot be registered for UNKNOWN events: "
                        + handler.getClass().getSimpleName());
            }
            InboundEventHandler previous = handlers.putIfAbsent(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for " + handler.type() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        Arrays.stream(InboundEventType.values())
                .filter(type -> type != InboundEventType.UNKNOWN && !handlers.containsKey(type))
                .findFirst()
                .ifPresent(type -> {
                    throw new IllegalStateException("No handler registered for " + type);
                });
    }

    public RoutingDecision route(String routingKey, byte[] payload) {
        InboundEventType type = InboundEventType.fromRoutingKey(routingKey);
        if (type == InboundEventType.UNKNOWN) {
            log.warn("No handler for routing key: {}", routingKey);
            return RoutingDecision.ACK;
        }

        try {
            handlers.get(type).handle(payload);
            return RoutingDecision.ACK;
        } catch (Exception e) {
            log.error("Error handling {}: {}. Message will be requeued", routingKey, e.getMessage(), e);
            return RoutingDecision.NACK_REQUEUE;
        }
    }
}
