package com.shiptrack.shippingservice.subscriber;

import com.shiptrack.shippingservice.config.AmqpConfig;

import java.util.Arrays;

/**
 * Inbound order events this service understands. Anything else resolves to UNKNOWN.
 */
public enum InboundEventType {
    ORDER_CONFIRMED(AmqpConfig.ROUTING_KEY_ORDER_CONFIRMED),
    ORDER_CANCELLED(AmqpConfig.ROUTING_KEY_ORDER_CANCELLED),
    UNKNOWN(null);

    private final String routingKey;

    InboundEventType(String routingKey) {
        this.routingKey = routingKey;
    }

    public static InboundEventType fromRoutingKey(String routingKey) {
        return Arrays.stream(values())
                .filter(type -> type.routingKey != null && type.routingKey.equals(routingKey))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
