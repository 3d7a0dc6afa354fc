package com.shiptrack.shippingservice.event;

import com.shiptrack.shippingservice.config.ShippingProperties;
import com.shiptrack.shippingservice.model.ShipmentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Publishes shipment domain events to RabbitMQ after the database transaction commits.
 * Messages are only sent for state that is durably stored, and a broker failure here
 * never rolls back or fails the state change.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShipmentEventPublisher {

    public static final String ROUTING_KEY_SHIPMENT_CREATED = "shipment.created";

    private final AmqpEventPublisher amqpEventPublisher;
    private final ShippingProperties properties;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onShipmentCreated(ShipmentCreatedEvent event) {
        log.info("Publishing shipment.created after successful DB commit: shipmentId={}, orderId={}",
                event.getContract().getShipmentId(), event.getContract().getOrderId());
        publishWithRetry(List.of(new OutboundEvent(ROUTING_KEY_SHIPMENT_CREATED, event.getContract())),
                event.getContract().getShipmentId());
    }

    /**
     * Every transition fans out to its specific routing key (e.g. shipment.delivered)
     * plus the generic shipment.status_updated.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onShipmentStatusChanged(ShipmentStatusChangedEvent event) {
        List<OutboundEvent> events = new ArrayList<>(2);
        event.getNewStatus().routingKey()
                .ifPresent(routingKey -> events.add(new OutboundEvent(routingKey, event.getContract())));
        events.add(new OutboundEvent(ShipmentStatus.STATUS_UPDATED_ROUTING_KEY, event.getContract()));

        log.info("Publishing status change after successful DB commit: shipmentId={}, {} -> {}",
                event.getContract().getShipmentId(), event.getContract().getOldStatus(),
                event.getContract().getNewStatus());
        publishWithRetry(events, event.getContract().getShipmentId());
    }

    PublishResult publishWithRetry(List<OutboundEvent> events, Long shipmentId) {
        try {
            PublishResult result = amqpEventPublisher.publishAll(events);
            int retries = properties.getMessaging().getPublishRetries();
            for (int attempt = 1; attempt <= retries && result.getStatus() == PublishResult.Status.CONNECTION_ERROR;
                 attempt++) {
                log.warn("Retrying publish after connection error: shipmentId={}, attempt={}", shipmentId, attempt);
                result = amqpEventPublisher.publishAll(events);
            }
            if (!result.isSuccess()) {
                log.error("Shipment events not published: shipmentId={}, status={}, error={}",
                        shipmentId, result.getStatus(), result.getError());
            }
            return result;
        } catch (RuntimeException e) {
            // State change is committed; publication problems must not surface to the caller
            log.error("Unexpected error while publishing shipment events: shipmentId={}", shipmentId, e);
            return PublishResult.publishError(e.getMessage());
        }
    }
}
