package com.shiptrack.shippingservice.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum ShipmentStatus {
    PENDING,          // Created, waiting for carrier pickup
    PICKED_UP,
    IN_TRANSIT,
    OUT_FOR_DELIVERY,
    DELIVERED,        // Terminal
    CANCELLED,        // Terminal
    FAILED;           // Delivery attempt failed, may go back in transit

    /**
     * Statuses in which a shipment still counts as active for its order.
     * A second 'order.confirmed' for the same order never creates a new shipment
     * while one of these exists, and 'order.cancelled' only looks at these.
     */
    public static final Set<ShipmentStatus> ACTIVE = EnumSet.of(PENDING, PICKED_UP, IN_TRANSIT);

    public static final String STATUS_UPDATED_ROUTING_KEY = "shipment.status_updated";

    /**
     * Routing key announcing a transition into this status, e.g. "shipment.picked_up".
     * PENDING is only ever the initial status, so it has none.
     */
    public Optional<String> routingKey() {
        if (this == PENDING) {
            return Optional.empty();
        }
        return Optional.of("shipment." + name().toLowerCase(Locale.ROOT));
    }
}
