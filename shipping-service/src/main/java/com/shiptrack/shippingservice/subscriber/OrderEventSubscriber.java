package com.shiptrack.shippingservice.subscriber;

import com.rabbitmq.client.Channel;
import com.shiptrack.shippingservice.config.AmqpConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Consumes order events from the shipping queue, one message at a time (prefetch 1,
 * manual acks), and settles each message with the router's decision.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventSubscriber {

    private final InboundEventRouter router;

    @RabbitListener(queues = "${shipping.messaging.queue}",
            containerFactory = AmqpConfig.ORDER_EVENTS_CONTAINER_FACTORY)
    public void onOrderEvent(Message message, Channel channel) throws IOException {
        MessageProperties props = message.getMessageProperties();
        String routingKey = props.getReceivedRoutingKey();
        long deliveryTag = props.getDeliveryTag();

        RoutingDecision decision = router.route(routingKey, message.getBody());
        switch (decision) {
            case ACK -> channel.basicAck(deliveryTag, false);
            case NACK_REQUEUE -> {
                log.warn("Rejecting message for redelivery: routingKey={}, redelivered={}",
                        routingKey, props.getRedelivered());
                channel.basicNack(deliveryTag, false, true);
            }
        }
    }
}
