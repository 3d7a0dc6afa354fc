package com.shiptrack.shippingservice.event;

import com.shiptrack.common.contracts.ShipmentStatusChangeContract;
import com.shiptrack.shippingservice.model.ShipmentStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Domain event raised for every accepted status transition (never for no-ops).
 * Published to RabbitMQ by {@link ShipmentEventPublisher} after commit.
 */
@Data
@AllArgsConstructor
public class ShipmentStatusChangedEvent {
    private ShipmentStatus newStatus;
    private ShipmentStatusChangeContract contract;
}
