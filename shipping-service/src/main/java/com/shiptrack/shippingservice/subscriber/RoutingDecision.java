package com.shiptrack.shippingservice.subscriber;

public enum RoutingDecision {
    ACK,
    NACK_REQUEUE
}
