package com.shiptrack.shippingservice.exception;

import com.shiptrack.shippingservice.model.ShipmentStatus;
import lombok.Getter;

/**
 * Exception thrown when a shipment status transition is not allowed
 * For example: moving a PENDING shipment straight to FAILED
 * HTTP Status: 422 Unprocessable Entity
 */
@Getter
public class InvalidStatusTransitionException extends RuntimeException {

    private final ShipmentStatus from;
    private final ShipmentStatus to;

    public InvalidStatusTransitionException(ShipmentStatus from, ShipmentStatus to) {
        super("Invalid status transition from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }
}
