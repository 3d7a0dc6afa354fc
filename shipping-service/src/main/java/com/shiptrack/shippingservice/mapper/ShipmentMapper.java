package com.shiptrack.shippingservice.mapper;

import com.shiptrack.common.contracts.ShipmentCreatedContract;
import com.shiptrack.common.contracts.ShipmentStatusChangeContract;
import com.shiptrack.shippingservice.dto.ShipmentHistoryResponse;
import com.shiptrack.shippingservice.dto.ShipmentResponse;
import com.shiptrack.shippingservice.model.Shipment;
import com.shiptrack.shippingservice.model.ShipmentHistory;
import com.shiptrack.shippingservice.model.ShipmentStatus;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ShipmentMapper {

    public ShipmentResponse toShipmentResponse(Shipment shipment) {
        return toShipmentResponse(shipment, null);
    }

    public ShipmentResponse toShipmentResponse(Shipment shipment, List<ShipmentHistory> history) {
        return ShipmentResponse.builder()
                .id(shipment.getId())
                .orderId(shipment.getOrderId())
                .trackingNo(shipment.getTrackingNo())
                .carrier(shipment.getCarrier())
                .status(shipment.getStatus())
                .shippedAt(shipment.getShippedAt())
                .deliveredAt(shipment.getDeliveredAt())
                .createdAt(shipment.getCreatedAt())
                .updatedAt(shipment.getUpdatedAt())
                .shippingAddress(shipment.getShippingAddress())
                .estimatedDelivery(shipment.getEstimatedDelivery())
                .actualWeight(shipment.getActualWeight())
                .notes(shipment.getNotes())
                .history(history == null ? null : history.stream().map(this::toHistoryResponse).toList())
                .build();
    }

    public ShipmentHistoryResponse toHistoryResponse(ShipmentHistory entry) {
        return ShipmentHistoryResponse.builder()
                .id(entry.getId())
                .status(entry.getStatus())
                .location(entry.getLocation())
                .description(entry.getDescription())
                .timestamp(entry.getCreatedAt())
                .build();
    }

    public ShipmentCreatedContract toCreatedContract(Shipment shipment) {
        return ShipmentCreatedContract.builder()
                .shipmentId(shipment.getId())
                .orderId(shipment.getOrderId())
                .trackingNo(shipment.getTrackingNo())
                .carrier(shipment.getCarrier().getLabel())
                .status(shipment.getStatus().name())
                .createdAt(shipment.getCreatedAt())
                .build();
    }

    /**
     * Builds the payload while the entity is still attached, so the after-commit
     * publisher never touches JPA state. updated_at is the entity's own value, which
     * {@link Shipment#changeStatus} stamped with the transition time.
     */
    public ShipmentStatusChangeContract toStatusChangeContract(Shipment shipment, ShipmentStatus oldStatus,
                                                               String reason) {
        return ShipmentStatusChangeContract.builder()
                .shipmentId(shipment.getId())
                .orderId(shipment.getOrderId())
                .trackingNo(shipment.getTrackingNo())
                .carrier(shipment.getCarrier().getLabel())
                .oldStatus(oldStatus.name())
                .newStatus(shipment.getStatus().name())
                .updatedAt(shipment.getUpdatedAt())
                .shippedAt(shipment.getShippedAt())
                .deliveredAt(shipment.getStatus() == ShipmentStatus.DELIVERED ? shipment.getDeliveredAt() : null)
                .reason(reason)
                .build();
    }
}
