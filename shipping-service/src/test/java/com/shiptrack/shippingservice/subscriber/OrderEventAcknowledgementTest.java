package com.shiptrack.shippingservice.subscriber;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import com.shiptrack.common.config.JacksonConfig;
import com.shiptrack.shippingservice.config.ShippingProperties;
import com.shiptrack.shippingservice.event.AmqpEventPublisher;
import com.shiptrack.shippingservice.event.ShipmentCreatedEvent;
import com.shiptrack.shippingservice.event.ShipmentEventPublisher;
import com.shiptrack.shippingservice.event.ShipmentStatusChangedEvent;
import com.shiptrack.shippingservice.mapper.ShipmentMapper;
import com.shiptrack.shippingservice.model.Carrier;
import com.shiptrack.shippingservice.model.Shipment;
import com.shiptrack.shippingservice.model.ShipmentStatus;
import com.shiptrack.shippingservice.repository.ShipmentRepository;
import com.shiptrack.shippingservice.service.AuditHistoryRecorder;
import com.shiptrack.shippingservice.service.ShipmentLifecycleServiceImpl;
import com.shiptrack.shippingservice.service.StatusStateMachine;
import com.shiptrack.shippingservice.service.TrackingNumberAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Drives an order event through the real handler, lifecycle service and after-commit
 * publisher while the broker rejects every outbound publish.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Order event acknowledgement when outbound publishing fails")
class OrderEventAcknowledgementTest {

    @Mock
    private ShipmentRepository shipmentRepository;

    @Mock
    private AuditHistoryRecorder auditHistoryRecorder;

    @Mock
    private RabbitTemplate rabbitTemplate;

    @Mock
    private Channel channel;

    @Mock
    private com.rabbitmq.client.ConnectionFactory rabbitFactory;

    @Mock
    private com.rabbitmq.client.Connection rabbitConnection;

    private CachingConnectionFactory sharedFactory;
    private Connection consumerConnection;
    private OrderEventSubscriber subscriber;

    static Stream<Arguments> brokerFailures() {
        // Connection errors are retried once (shipping.messaging.publish-retries=1)
        return Stream.of(
                Arguments.of(new AmqpConnectException(new ConnectException("Connection refused")), 2),
                Arguments.of(new AmqpIOException(new IOException("channel closed")), 1));
    }

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(rabbitFactory.newConnection((ExecutorService) any(), (String) any()))
                .thenReturn(rabbitConnection);
        lenient().when(rabbitConnection.isOpen()).thenReturn(true);
        sharedFactory = new CachingConnectionFactory(rabbitFactory);
        // The listener container holds this connection while the message is in flight
        consumerConnection = sharedFactory.createConnection();
        lenient().when(rabbitTemplate.getConnectionFactory()).thenReturn(sharedFactory);

        ObjectMapper objectMapper = JacksonConfig.configure(new ObjectMapper());
        ShippingProperties properties = new ShippingProperties();

        AmqpEventPublisher amqpEventPublisher = new AmqpEventPublisher(rabbitTemplate, objectMapper, properties);
        ShipmentEventPublisher shipmentEventPublisher = new ShipmentEventPublisher(amqpEventPublisher, properties);
        // No transaction here, so the after-commit listeners run inline as with fallbackExecution
        ApplicationEventPublisher eventPublisher = event -> {
            if (event instanceof ShipmentCreatedEvent created) {
                shipmentEventPublisher.onShipmentCreated(created);
            } else if (event instanceof ShipmentStatusChangedEvent statusChanged) {
                shipmentEventPublisher.onShipmentStatusChanged(statusChanged);
            }
        };

        ShipmentLifecycleServiceImpl service = new ShipmentLifecycleServiceImpl(
                shipmentRepository,
                new StatusStateMachine(),
                new TrackingNumberAllocator(shipmentRepository, properties),
                auditHistoryRecorder,
                new ShipmentMapper(),
                eventPublisher,
                properties);
        ReflectionTestUtils.setField(service, "self", service);

        InboundEventRouter router = new InboundEventRouter(List.of(
                new OrderConfirmedHandler(service, objectMapper),
                new OrderCancelledHandler(service, objectMapper)));
        subscriber = new OrderEventSubscriber(router);
    }

    @AfterEach
    void tearDown() {
        sharedFactory.destroy();
    }

    private static Message message(String routingKey, long deliveryTag, String json) {
        MessageProperties props = new MessageProperties();
        props.setReceivedRoutingKey(routingKey);
        props.setDeliveryTag(deliveryTag);
        return new Message(json.getBytes(StandardCharsets.UTF_8), props);
    }

    private void assertConsumerConnectionSurvived() throws IOException {
        verify(rabbitConnection, never()).close();
        verify(rabbitConnection, never()).close(anyInt());
        assertThat(consumerConnection.isOpen()).isTrue();
        assertThat(sharedFactory.createConnection()).isSameAs(consumerConnection);
    }

    @Nested
    @DisplayName("order.confirmed")
    class OrderConfirmedTests {

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.shiptrack.shippingservice.subscriber.OrderEventAcknowledgementTest#brokerFailures")
        @DisplayName("should ACK once the shipment is stored even though shipment.created is not published")
        void shouldAckCreatedShipment(AmqpException failure, int expectedAttempts) throws IOException {
            when(shipmentRepository.findFirstByOrderIdAndStatusInOrderByCreatedAtDesc(eq(7L), any()))
                    .thenReturn(Optional.empty());
            when(shipmentRepository.existsByTrackingNo(anyString())).thenReturn(false);
            when(shipmentRepository.saveAndFlush(any(Shipment.class))).thenAnswer(inv -> {
                Shipment s = inv.getArgument(0);
                s.setId(1L);
                s.setCreatedAt(Instant.now());
                return s;
            });
            when(rabbitTemplate.invoke(any())).thenThrow(failure);

            subscriber.onOrderEvent(message("order.confirmed", 11L,
                    "{\"order_id\":7,\"shipping_address\":\"221B Baker Street\"}"), channel);

            verify(shipmentRepository).saveAndFlush(any(Shipment.class));
            verify(rabbitTemplate, times(expectedAttempts)).invoke(any());
            verify(channel).basicAck(11L, false);
            verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
            assertConsumerConnectionSurvived();
        }
    }

    @Nested
    @DisplayName("order.cancelled")
    class OrderCancelledTests {

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.shiptrack.shippingservice.subscriber.OrderEventAcknowledgementTest#brokerFailures")
        @DisplayName("should ACK once the shipment is cancelled even though the status events are not published")
        void shouldAckCancelledShipment(AmqpException failure, int expectedAttempts) throws IOException {
            Shipment pending = Shipment.builder()
                    .id(3L)
                    .orderId(9L)
                    .trackingNo("TRK1003")
                    .carrier(Carrier.DHL)
                    .createdAt(Instant.now())
                    .build();
            when(shipmentRepository.findByOrderIdAndStatusInWithLock(eq(9L), any())).thenReturn(List.of(pending));
            when(shipmentRepository.save(any(Shipment.class))).thenAnswer(inv -> inv.getArgument(0));
            when(rabbitTemplate.invoke(any())).thenThrow(failure);

            subscriber.onOrderEvent(message("order.cancelled", 12L, "{\"order_id\":9}"), channel);

            assertThat(pending.getStatus()).isEqualTo(ShipmentStatus.CANCELLED);
            verify(rabbitTemplate, times(expectedAttempts)).invoke(any());
            verify(channel).basicAck(12L, false);
            verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
            assertConsumerConnectionSurvived();
        }
    }
}
