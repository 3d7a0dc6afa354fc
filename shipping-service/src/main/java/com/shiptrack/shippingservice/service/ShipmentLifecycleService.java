package com.shiptrack.shippingservice.service;

import com.shiptrack.shippingservice.dto.CreateShipmentRequest;
import com.shiptrack.shippingservice.dto.ShipmentCreationResult;
import com.shiptrack.shippingservice.dto.ShipmentHistoryResponse;
import com.shiptrack.shippingservice.dto.ShipmentResponse;
import com.shiptrack.shippingservice.dto.ShipmentStatisticsResponse;
import com.shiptrack.shippingservice.dto.UpdateShipmentRequest;
import com.shiptrack.shippingservice.model.ShipmentStatus;
import jakarta.validation.Valid;

import java.util.List;

public interface ShipmentLifecycleService {
    /**
     * Creates the shipment for a confirmed order.
     * Idempotent for redelivered 'order.confirmed' events: if the order already has a
     * shipment in PENDING, PICKED_UP or IN_TRANSIT, that shipment is returned and nothing
     * is allocated, stored or published.
     *
     * @param orderId         The order reference, must be positive
     * @param shippingAddress Optional free-form address
     * @return the new shipment (created=true) or the existing one (created=false)
     */
    ShipmentCreationResult createFromOrder(Long orderId, String shippingAddress);

    /**
     * Direct creation path. Same idempotency boundary as {@link #createFromOrder}.
     * The carrier defaults to the configured one when absent.
     *
     * @throws jakarta.validation.ConstraintViolationException if the request breaks its field constraints
     */
    ShipmentCreationResult createShipment(@Valid CreateShipmentRequest request);

    /**
     * Cancels every active shipment of a cancelled order.
     * Each cancellation goes through the state machine; shipments it does not allow to be
     * cancelled are left untouched. Replays find nothing left to cancel.
     *
     * @return the shipments that were cancelled by this call (possibly empty)
     */
    List<ShipmentResponse> cancelForOrder(Long orderId);

    /**
     * Validates and applies a status change. Re-submitting the current status is a no-op:
     * no history row and no event.
     *
     * @throws com.shiptrack.shippingservice.exception.InvalidStatusTransitionException if the transition is not allowed
     * @throws com.shiptrack.common.exception.ResourceNotFoundException                  if the shipment does not exist
     */
    ShipmentResponse applyStatusUpdate(Long shipmentId, ShipmentStatus requestedStatus,
                                       String location, String description);

    /**
     * Partial update of free-form attributes, optionally combined with a status change
     * that follows the same rules as {@link #applyStatusUpdate}.
     */
    ShipmentResponse updateShipment(Long shipmentId, @Valid UpdateShipmentRequest request);

    ShipmentResponse getShipment(Long shipmentId);

    ShipmentResponse getByTrackingNo(String trackingNo);

    List<ShipmentResponse> getByOrderId(Long orderId);

    List<ShipmentHistoryResponse> getHistory(Long shipmentId);

    ShipmentStatisticsResponse getStatistics();

    /**
     * Administrative delete; the shipment's history goes with it.
     */
    void deleteShipment(Long shipmentId);
}
