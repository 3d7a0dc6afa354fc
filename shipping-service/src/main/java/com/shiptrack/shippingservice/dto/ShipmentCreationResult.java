package com.shiptrack.shippingservice.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a create request: either a new shipment, or the active shipment
 * that already exists for the order (redelivered 'order.confirmed').
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ShipmentCreationResult {

    private final ShipmentResponse shipment;
    private final boolean created;

    public static ShipmentCreationResult created(ShipmentResponse shipment) {
        return new ShipmentCreationResult(shipment, true);
    }

    public static ShipmentCreationResult existing(ShipmentResponse shipment) {
        return new ShipmentCreationResult(shipment, false);
    }
}
