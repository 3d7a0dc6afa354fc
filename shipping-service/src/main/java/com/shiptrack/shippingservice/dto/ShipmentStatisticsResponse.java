package com.shiptrack.shippingservice.dto;

import com.shiptrack.shippingservice.model.Carrier;
import com.shiptrack.shippingservice.model.ShipmentStatus;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class ShipmentStatisticsResponse {
    private Map<ShipmentStatus, Long> statusDistribution;
    private Map<Carrier, Long> carrierDistribution;
    private long totalShipments;
}
