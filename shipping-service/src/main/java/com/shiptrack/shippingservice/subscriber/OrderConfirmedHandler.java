package com.shiptrack.shippingservice.subscriber;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiptrack.common.contracts.OrderConfirmedContract;
import com.shiptrack.shippingservice.dto.ShipmentCreationResult;
import com.shiptrack.shippingservice.service.ShipmentLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 'order.confirmed' creates the order's shipment.
 * Replays are absorbed by createFromOrder, which returns the existing active shipment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderConfirmedHandler implements InboundEventHandler {

    private final ShipmentLifecycleService shipmentLifecycleService;
    private final ObjectMapper objectMapper;

    @Override
    public InboundEventType type() {
        return InboundEventType.ORDER_CONFIRMED;
    }

    @Override
    public void handle(byte[] payload) throws IOException {
        OrderConfirmedContract contract = objectMapper.readValue(payload, OrderConfirmedContract.class);
        log.info("Received order.confirmed event: orderId={}", contract.getOrderId());

        if (contract.getOrderId() == null) {
            throw new IllegalArgumentException("order.confirmed event without order_id");
        }

        ShipmentCreationResult result = shipmentLifecycleService.createFromOrder(
                contract.getOrderId(), contract.getShippingAddress());

        if (result.isCreated()) {
            log.info("Shipment {} created for order {}", result.getShipment().getId(), contract.getOrderId());
        } else {
            log.info("Shipment already exists for order {}, skipping", contract.getOrderId());
        }
    }
}
