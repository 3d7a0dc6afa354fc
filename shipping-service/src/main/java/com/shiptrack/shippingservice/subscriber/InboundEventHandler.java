package com.shiptrack.shippingservice.subscriber;

import java.io.IOException;

/**
 * Handles one kind of inbound order event.
 *
 * Delivery is at-least-once, so implementations must be safe to run again for the
 * same message. Throwing makes the router requeue the message.
 */
public interface InboundEventHandler {

    InboundEventType type();

    void handle(byte[] payload) throws IOException;
}
