package com.shiptrack.shippingservice.dto;

import com.shiptrack.shippingservice.model.Carrier;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateShipmentRequest {
    @NotNull(message = "Order ID is required")
    @Positive(message = "Order ID must be positive")
    private Long orderId;

    private Carrier carrier; // defaults to shipping.default-carrier
    private String shippingAddress;
    private Instant estimatedDelivery;

    @DecimalMin(value = "0.0", message = "Weight must not be negative")
    private BigDecimal actualWeight;

    private String notes;
}
