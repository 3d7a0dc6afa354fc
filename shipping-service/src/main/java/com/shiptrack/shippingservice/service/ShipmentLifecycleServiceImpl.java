package com.shiptrack.shippingservice.service;

import com.shiptrack.common.exception.ResourceNotFoundException;
import com.shiptrack.shippingservice.config.ShippingProperties;
import com.shiptrack.shippingservice.dto.CreateShipmentRequest;
import com.shiptrack.shippingservice.dto.ShipmentCreationResult;
import com.shiptrack.shippingservice.dto.ShipmentHistoryResponse;
import com.shiptrack.shippingservice.dto.ShipmentResponse;
import com.shiptrack.shippingservice.dto.ShipmentStatisticsResponse;
import com.shiptrack.shippingservice.dto.UpdateShipmentRequest;
import com.shiptrack.shippingservice.event.ShipmentCreatedEvent;
import com.shiptrack.shippingservice.event.ShipmentStatusChangedEvent;
import com.shiptrack.shippingservice.exception.InvalidStatusTransitionException;
import com.shiptrack.shippingservice.mapper.ShipmentMapper;
import com.shiptrack.shippingservice.model.Carrier;
import com.shiptrack.shippingservice.model.Shipment;
import com.shiptrack.shippingservice.model.ShipmentStatus;
import com.shiptrack.shippingservice.repository.ShipmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ShipmentLifecycleServiceImpl implements ShipmentLifecycleService {

    static final String ORDER_CANCELLED_REASON = "order_cancelled";

    private final ShipmentRepository shipmentRepository;
    private final StatusStateMachine statusStateMachine;
    private final TrackingNumberAllocator trackingNumberAllocator;
    private final AuditHistoryRecorder auditHistoryRecorder;
    private final ShipmentMapper shipmentMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final ShippingProperties properties;

    @Autowired
    @Lazy
    private ShipmentLifecycleServiceImpl self;

    @Override
    public ShipmentCreationResult createFromOrder(Long orderId, String shippingAddress) {
        return createShipment(CreateShipmentRequest.builder()
                .orderId(orderId)
                .shippingAddress(shippingAddress)
                .build());
    }

    /**
     * Not transactional itself: each insert attempt runs in its own transaction
     * (via the 'self' proxy) so a tracking number unique-constraint violation can be
     * retried with a fresh number instead of poisoning the surrounding transaction.
     */
    @Override
    public ShipmentCreationResult createShipment(CreateShipmentRequest request) {
        Long orderId = request.getOrderId();
        requirePositiveOrderId(orderId);

        Optional<Shipment> existing = shipmentRepository
                .findFirstByOrderIdAndStatusInOrderByCreatedAtDesc(orderId, ShipmentStatus.ACTIVE);
        if (existing.isPresent()) {
            log.info("Shipment already exists for order (idempotent replay). orderId={}, shipmentId={}, status={}",
                    orderId, existing.get().getId(), existing.get().getStatus());
            return ShipmentCreationResult.existing(shipmentMapper.toShipmentResponse(existing.get()));
        }

        Shipment created = trackingNumberAllocator.reserve(trackingNo -> self.insertShipment(request, trackingNo));
        log.info("Created shipment {} for order {}: trackingNo={}, carrier={}",
                created.getId(), orderId, created.getTrackingNo(), created.getCarrier());
        return ShipmentCreationResult.created(shipmentMapper.toShipmentResponse(created));
    }

    @Transactional
    public Shipment insertShipment(CreateShipmentRequest request, String trackingNo) {
        Carrier carrier = request.getCarrier() != null ? request.getCarrier() : properties.getDefaultCarrier();

        Shipment shipment = Shipment.builder()
                .orderId(request.getOrderId())
                .trackingNo(trackingNo)
                .carrier(carrier)
                .shippingAddress(request.getShippingAddress())
                .estimatedDelivery(request.getEstimatedDelivery())
                .actualWeight(request.getActualWeight())
                .notes(request.getNotes())
                .updatedAt(Instant.now())
                .build();

        // Flush now so a duplicate tracking number fails inside this attempt
        Shipment saved = shipmentRepository.saveAndFlush(shipment);
        eventPublisher.publishEvent(new ShipmentCreatedEvent(shipmentMapper.toCreatedContract(saved)));
        return saved;
    }

    @Override
    @Transactional
    public List<ShipmentResponse> cancelForOrder(Long orderId) {
        requirePositiveOrderId(orderId);

        List<Shipment> active = shipmentRepository.findByOrderIdAndStatusInWithLock(orderId, ShipmentStatus.ACTIVE);
        if (active.isEmpty()) {
            log.info("No active shipments to cancel for order {}", orderId);
            return List.of();
        }

        Instant now = Instant.now();
        List<ShipmentResponse> cancelled = new ArrayList<>();
        for (Shipment shipment : active) {
            ShipmentStatus oldStatus = shipment.getStatus();
            try {
                statusStateMachine.validate(oldStatus, ShipmentStatus.CANCELLED);
            } catch (InvalidStatusTransitionException e) {
                log.warn("Shipment cannot be cancelled, leaving it untouched: shipmentId={}, orderId={}, status={}",
                        shipment.getId(), orderId, oldStatus);
                continue;
            }

            shipment.changeStatus(ShipmentStatus.CANCELLED, now);
            Shipment saved = shipmentRepository.save(shipment);
            auditHistoryRecorder.record(saved, null, "Shipment cancelled: order " + orderId + " was cancelled");
            eventPublisher.publishEvent(new ShipmentStatusChangedEvent(ShipmentStatus.CANCELLED,
                    shipmentMapper.toStatusChangeContract(saved, oldStatus, ORDER_CANCELLED_REASON)));

            log.info("Cancelled shipment {} for order {}", saved.getId(), orderId);
            cancelled.add(shipmentMapper.toShipmentResponse(saved));
        }
        return cancelled;
    }

    @Override
    @Transactional
    public ShipmentResponse applyStatusUpdate(Long shipmentId, ShipmentStatus requestedStatus,
                                              String location, String description) {
        if (requestedStatus == null) {
            throw new IllegalArgumentException("Requested status is required");
        }
        return updateShipment(shipmentId, UpdateShipmentRequest.builder()
                .status(requestedStatus)
                .location(location)
                .description(description)
                .build());
    }

    @Override
    @Transactional
    public ShipmentResponse updateShipment(Long shipmentId, UpdateShipmentRequest request) {
        Shipment shipment = shipmentRepository.findByIdWithLock(shipmentId)
                .orElseThrow(() -> {
                    log.warn("Shipment not found: shipmentId={}", shipmentId);
                    return new ResourceNotFoundException("Shipment not found with id: " + shipmentId);
                });

        ShipmentStatus oldStatus = shipment.getStatus();
        ShipmentStatus requestedStatus = request.getStatus();
        boolean statusChanged = false;
        if (requestedStatus != null) {
            // Rejects before anything is touched
            statusStateMachine.validate(oldStatus, requestedStatus);
            statusChanged = requestedStatus != oldStatus;
        }

        applyDetails(shipment, request);

        Instant now = Instant.now();
        if (statusChanged) {
            shipment.changeStatus(requestedStatus, now);
        } else {
            shipment.setUpdatedAt(now);
        }
        Shipment saved = shipmentRepository.save(shipment);

        if (statusChanged) {
            auditHistoryRecorder.record(saved, request.getLocation(), request.getDescription());
            eventPublisher.publishEvent(new ShipmentStatusChangedEvent(requestedStatus,
                    shipmentMapper.toStatusChangeContract(saved, oldStatus, null)));
            log.info("Shipment status updated: shipmentId={}, oldStatus={}, newStatus={}",
                    shipmentId, oldStatus, requestedStatus);
        } else if (requestedStatus != null) {
            log.info("Status unchanged (idempotent re-submission): shipmentId={}, status={}", shipmentId, oldStatus);
        }

        return shipmentMapper.toShipmentResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public ShipmentResponse getShipment(Long shipmentId) {
        Shipment shipment = findShipment(shipmentId);
        return shipmentMapper.toShipmentResponse(shipment, auditHistoryRecorder.historyOf(shipmentId));
    }

    @Override
    @Transactional(readOnly = true)
    public ShipmentResponse getByTrackingNo(String trackingNo) {
        if (trackingNo == null || trackingNo.isBlank()) {
            throw new IllegalArgumentException("tracking_no parameter is required");
        }
        Shipment shipment = shipmentRepository.findByTrackingNo(trackingNo)
                .orElseThrow(() -> new ResourceNotFoundException("Shipment not found with tracking number: "
                        + trackingNo));
        return shipmentMapper.toShipmentResponse(shipment);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ShipmentResponse> getByOrderId(Long orderId) {
        requirePositiveOrderId(orderId);
        return shipmentRepository.findByOrderIdOrderByCreatedAtDesc(orderId).stream()
                .map(shipmentMapper::toShipmentResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ShipmentHistoryResponse> getHistory(Long shipmentId) {
        if (!shipmentRepository.existsById(shipmentId)) {
            throw new ResourceNotFoundException("Shipment not found with id: " + shipmentId);
        }
        return auditHistoryRecorder.historyOf(shipmentId).stream()
                .map(shipmentMapper::toHistoryResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public ShipmentStatisticsResponse getStatistics() {
        Map<ShipmentStatus, Long> byStatus = new EnumMap<>(ShipmentStatus.class);
        shipmentRepository.countByStatus().forEach(row -> byStatus.put(row.getStatus(), row.getTotal()));

        Map<Carrier, Long> byCarrier = new EnumMap<>(Carrier.class);
        shipmentRepository.countByCarrier().forEach(row -> byCarrier.put(row.getCarrier(), row.getTotal()));

        return ShipmentStatisticsResponse.builder()
                .statusDistribution(byStatus)
                .carrierDistribution(byCarrier)
                .totalShipments(shipmentRepository.count())
                .build();
    }

    @Override
    @Transactional
    public void deleteShipment(Long shipmentId) {
        Shipment shipment = findShipment(shipmentId);
        shipmentRepository.delete(shipment);
        log.info("Shipment deleted: shipmentId={}, orderId={}", shipmentId, shipment.getOrderId());
    }

    private Shipment findShipment(Long shipmentId) {
        return shipmentRepository.findById(shipmentId)
                .orElseThrow(() -> {
                    log.warn("Shipment not found: shipmentId={}", shipmentId);
                    return new ResourceNotFoundException("Shipment not found with id: " + shipmentId);
                });
    }

    private void applyDetails(Shipment shipment, UpdateShipmentRequest request) {
        if (request.getNotes() != null) {
            shipment.setNotes(request.getNotes());
        }
        if (request.getShippingAddress() != null) {
            shipment.setShippingAddress(request.getShippingAddress());
        }
        if (request.getEstimatedDelivery() != null) {
            shipment.setEstimatedDelivery(request.getEstimatedDelivery());
        }
        if (request.getActualWeight() != null) {
            shipment.setActualWeight(request.getActualWeight());
        }
    }

    private static void requirePositiveOrderId(Long orderId) {
        if (orderId == null || orderId <= 0) {
            throw new IllegalArgumentException("Order ID must be positive, got: " + orderId);
        }
    }
}
