package com.shiptrack.shippingservice.service;

import com.shiptrack.shippingservice.model.Shipment;
import com.shiptrack.shippingservice.model.ShipmentHistory;
import com.shiptrack.shippingservice.repository.ShipmentHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Appends audit rows for accepted status transitions.
 * Callers invoke it only after the status has actually changed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHistoryRecorder {

    private final ShipmentHistoryRepository historyRepository;

    public ShipmentHistory record(Shipment shipment, String location, String description) {
        ShipmentHistory entry = ShipmentHistory.builder()
                .shipment(shipment)
                .status(shipment.getStatus())
                .location(location == null || location.isBlank() ? "" : location)
                .description(description == null || description.isBlank()
                        ? "Status updated to " + shipment.getStatus()
                        : description)
                .build();

        ShipmentHistory saved = historyRepository.save(entry);
        log.info("History recorded: shipmentId={}, status={}", shipment.getId(), shipment.getStatus());
        return saved;
    }

    public List<ShipmentHistory> historyOf(Long shipmentId) {
        return historyRepository.findByShipmentIdOrderByCreatedAtDescIdDesc(shipmentId);
    }
}
