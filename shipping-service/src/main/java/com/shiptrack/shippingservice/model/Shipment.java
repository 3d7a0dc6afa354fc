package com.shiptrack.shippingservice.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "shipments", indexes = {
        @Index(name = "idx_shipments_order_status", columnList = "order_id, status"),
        @Index(name = "idx_shipments_created_at", columnList = "created_at")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Shipment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    @Column(name = "order_id", nullable = false)
    @ToString.Include
    private Long orderId;

    @Column(name = "tracking_no", nullable = false, unique = true, length = 50)
    @ToString.Include
    private String trackingNo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private Carrier carrier;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    @ToString.Include
    private ShipmentStatus status = ShipmentStatus.PENDING;

    // Append-once: only changeStatus() writes these
    @Column(name = "shipped_at")
    @Setter(AccessLevel.NONE)
    private Instant shippedAt;

    @Column(name = "delivered_at")
    @Setter(AccessLevel.NONE)
    private Instant deliveredAt;

    @Column(name = "shipping_address", columnDefinition = "text")
    private String shippingAddress;

    @Column(name = "estimated_delivery")
    private Instant estimatedDelivery;

    // Weight in kg
    @Column(name = "actual_weight", precision = 10, scale = 2)
    private BigDecimal actualWeight;

    @Column(columnDefinition = "text")
    private String notes;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    // Stamped by the service with the same instant that goes into the outbound event
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * Moves the shipment to {@code newStatus} and stamps the lifecycle timestamps.
     * Callers validate the transition first; this method only keeps the timestamps consistent:
     * shippedAt is set on the first move into PICKED_UP or IN_TRANSIT, deliveredAt on DELIVERED,
     * and neither is ever cleared. updatedAt becomes {@code at}.
     */
    public void changeStatus(ShipmentStatus newStatus, Instant at) {
        this.status = newStatus;
        this.updatedAt = at;
        if ((newStatus == ShipmentStatus.PICKED_UP || newStatus == ShipmentStatus.IN_TRANSIT) && shippedAt == null) {
            this.shippedAt = at;
        }
        if (newStatus == ShipmentStatus.DELIVERED && deliveredAt == null) {
            this.deliveredAt = at;
        }
    }
}
