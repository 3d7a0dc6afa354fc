package com.shiptrack.shippingservice.event;

import com.shiptrack.common.contracts.ShipmentCreatedContract;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Domain event raised inside the creating transaction.
 * Published to RabbitMQ by {@link ShipmentEventPublisher} after commit.
 */
@Data
@AllArgsConstructor
public class ShipmentCreatedEvent {
    private ShipmentCreatedContract contract;
}
