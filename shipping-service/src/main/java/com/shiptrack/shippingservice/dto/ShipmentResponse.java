package com.shiptrack.shippingservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shiptrack.shippingservice.model.Carrier;
import com.shiptrack.shippingservice.model.ShipmentStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ShipmentResponse {
    private Long id;
    private Long orderId;
    private String trackingNo;
    private Carrier carrier;
    private ShipmentStatus status;
    private Instant shippedAt;
    private Instant deliveredAt;
    private Instant createdAt;
    private Instant updatedAt;
    private String shippingAddress;
    private Instant estimatedDelivery;
    private BigDecimal actualWeight;
    private String notes;
    private List<ShipmentHistoryResponse> history; // only on single-shipment reads
}
