package com.shiptrack.shippingservice.config;

import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AmqpConfig {

    public static final String ROUTING_KEY_ORDER_CONFIRMED = "order.confirmed";
    public static final String ROUTING_KEY_ORDER_CANCELLED = "order.cancelled";

    public static final String ORDER_EVENTS_CONTAINER_FACTORY = "orderEventsContainerFactory";

    @Bean
    public TopicExchange eventsExchange(ShippingProperties properties) {
        // Durable topic exchange shared by the order and shipping services
        return new TopicExchange(properties.getMessaging().getExchange(), true, false);
    }

    @Bean
    public Queue shippingQueue(ShippingProperties properties) {
        return QueueBuilder.durable(properties.getMessaging().getQueue()).build();
    }

    @Bean
    public Binding orderConfirmedBinding(Queue shippingQueue, TopicExchange eventsExchange) {
        return BindingBuilder.bind(shippingQueue).to(eventsExchange).with(ROUTING_KEY_ORDER_CONFIRMED);
    }

    @Bean
    public Binding orderCancelledBinding(Queue shippingQueue, TopicExchange eventsExchange) {
        return BindingBuilder.bind(shippingQueue).to(eventsExchange).with(ROUTING_KEY_ORDER_CANCELLED);
    }

    /**
     * Listener container for order events: one consumer, prefetch 1, manual acks.
     * The subscriber decides ack/nack per message, and on shutdown the container
     * waits for the in-flight message before closing the channel.
     */
    @Bean(name = ORDER_EVENTS_CONTAINER_FACTORY)
    public SimpleRabbitListenerContainerFactory orderEventsContainerFactory(
            SimpleRabbitListenerContainerFactoryConfigurer configurer,
            ConnectionFactory connectionFactory,
            ShippingProperties properties) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        configurer.configure(factory, connectionFactory);
        factory.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        factory.setPrefetchCount(1);
        factory.setConcurrentConsumers(1);
        factory.setMaxConcurrentConsumers(1);
        factory.setDefaultRequeueRejected(true);
        factory.setAutoStartup(properties.getMessaging().isEnabled());
        long shutdownTimeout = properties.getMessaging().getShutdownTimeout().toMillis();
        factory.setContainerCustomizer(container -> container.setShutdownTimeout(shutdownTimeout));
        return factory;
    }
}
