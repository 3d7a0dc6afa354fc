package com.shiptrack.shippingservice.dto;

import com.shiptrack.shippingservice.model.ShipmentStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ShipmentHistoryResponse {
    private Long id;
    private ShipmentStatus status;
    private String location;
    private String description;
    private Instant timestamp;
}
