package com.shiptrack.common.contracts;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Contract for shipment status change events.
 *
 * Used for:
 * - shipment.picked_up, shipment.in_transit, shipment.out_for_delivery
 * - shipment.delivered (carries deliveredAt)
 * - shipment.cancelled, shipment.failed
 * - shipment.status_updated (sent alongside every specific event)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ShipmentStatusChangeContract {
    private Long shipmentId;
    private Long orderId;
    private String trackingNo;
    private String carrier;
    private String oldStatus;
    private String newStatus;
    private Instant updatedAt;
    private Instant shippedAt;   // nullable until first pickup
    private Instant deliveredAt; // only on delivered
    private String reason;       // e.g. "order_cancelled" when the order service drove the change
}
