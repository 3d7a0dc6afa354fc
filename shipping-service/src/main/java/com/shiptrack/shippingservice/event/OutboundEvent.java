package com.shiptrack.shippingservice.event;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class OutboundEvent {
    private String routingKey;
    private Object payload;
}
