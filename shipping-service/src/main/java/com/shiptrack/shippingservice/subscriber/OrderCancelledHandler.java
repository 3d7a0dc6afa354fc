package com.shiptrack.shippingservice.subscriber;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiptrack.common.contracts.OrderCancelledContract;
import com.shiptrack.shippingservice.dto.ShipmentResponse;
import com.shiptrack.shippingservice.service.ShipmentLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * 'order.cancelled' cancels the order's active shipments.
 * Already-terminal shipments are never selected, so a replay cancels nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderCancelledHandler implements InboundEventHandler {

    private final ShipmentLifecycleService shipmentLifecycleService;
    private final ObjectMapper objectMapper;

    @Override
    public InboundEventType type() {
        return InboundEventType.ORDER_CANCELLED;
    }

    @Override
    public void handle(byte[] payload) throws IOException {
        OrderCancelledContract contract = objectMapper.readValue(payload, OrderCancelledContract.class);
        log.info("Received order.cancelled event: orderId={}", contract.getOrderId());

        if (contract.getOrderId() == null) {
            throw new IllegalArgumentException("order.cancelled event without order_id");
        }

        List<ShipmentResponse> cancelled = shipmentLifecycleService.cancelForOrder(contract.getOrderId());
        log.info("Cancelled {} shipment(s) for order {}", cancelled.size(), contract.getOrderId());
    }
}
