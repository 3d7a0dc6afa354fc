package com.shiptrack.shippingservice.dto;

import com.shiptrack.shippingservice.model.ShipmentStatus;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Partial update: null fields are left untouched.
 * location and description only go into the history row written for a status change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateShipmentRequest {
    private ShipmentStatus status;
    private String location;
    private String description;

    private String notes;
    private String shippingAddress;
    private Instant estimatedDelivery;

    @DecimalMin(value = "0.0", message = "Weight must not be negative")
    private BigDecimal actualWeight;
}
