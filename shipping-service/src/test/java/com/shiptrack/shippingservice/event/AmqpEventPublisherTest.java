package com.shiptrack.shippingservice.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiptrack.common.config.JacksonConfig;
import com.shiptrack.common.contracts.ShipmentCreatedContract;
import com.shiptrack.shippingservice.config.ShippingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.core.RabbitOperations;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AmqpEventPublisher Unit Tests")
class AmqpEventPublisherTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    @Mock
    private RabbitOperations rabbitOperations;

    @Mock
    private CachingConnectionFactory connectionFactory;

    private ObjectMapper objectMapper;
    private ShippingProperties properties;
    private AmqpEventPublisher publisher;

    private ShipmentCreatedContract contract;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfig.configure(new ObjectMapper());
        properties = new ShippingProperties();
        properties.getMessaging().setExchange("ecommerce_events");
        publisher = new AmqpEventPublisher(rabbitTemplate, objectMapper, properties);

        contract = ShipmentCreatedContract.builder()
                .shipmentId(1L)
                .orderId(7L)
                .trackingNo("TRK4821")
                .carrier("DHL")
                .status("PENDING")
                .createdAt(Instant.parse("2024-03-01T10:00:00Z"))
                .build();
    }

    private void invokeRunsCallback() {
        when(rabbitTemplate.invoke(any())).thenAnswer(inv -> {
            RabbitOperations.OperationsCallback<?> callback = inv.getArgument(0);
            return callback.doInRabbit(rabbitOperations);
        });
    }

    @Nested
    @DisplayName("Successful Publishing")
    class SuccessTests {

        @Test
        @DisplayName("should send a persistent JSON message with snake_case body")
        void shouldSendPersistentJsonMessage() throws IOException {
            invokeRunsCallback();

            PublishResult result = publisher.publish("shipment.created", contract);

            assertThat(result.getStatus()).isEqualTo(PublishResult.Status.PUBLISHED);
            assertThat(result.getPublished()).isEqualTo(1);
            assertThat(result.isSuccess()).isTrue();

            ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
            verify(rabbitOperations).send(eq("ecommerce_events"), eq("shipment.created"), captor.capture());

            Message message = captor.getValue();
            MessageProperties props = message.getMessageProperties();
            assertThat(props.getContentType()).isEqualTo(MessageProperties.CONTENT_TYPE_JSON);
            assertThat(props.getContentEncoding()).isEqualTo("UTF-8");
            assertThat(props.getDeliveryMode()).isEqualTo(MessageDeliveryMode.PERSISTENT);
            assertThat(props.getMessageId()).isNotBlank();
            assertThat(props.getTimestamp()).isNotNull();

            JsonNode body = objectMapper.readTree(message.getBody());
            assertThat(body.get("shipment_id").asLong()).isEqualTo(1L);
            assertThat(body.get("order_id").asLong()).isEqualTo(7L);
            assertThat(body.get("tracking_no").asText()).isEqualTo("TRK4821");
            assertThat(body.get("created_at").asText()).isEqualTo("2024-03-01T10:00:00Z");
        }

        @Test
        @DisplayName("should send a batch in order on one scoped channel")
        void shouldSendBatchInOrder() {
            invokeRunsCallback();

            PublishResult result = publisher.publishAll(List.of(
                    new OutboundEvent("shipment.delivered", contract),
                    new OutboundEvent("shipment.status_updated", contract)));

            assertThat(result.getPublished()).isEqualTo(2);
            verify(rabbitTemplate, times(1)).invoke(any());
            InOrder inOrder = inOrder(rabbitOperations);
            inOrder.verify(rabbitOperations).send(eq("ecommerce_events"), eq("shipment.delivered"), any(Message.class));
            inOrder.verify(rabbitOperations).send(eq("ecommerce_events"), eq("shipment.status_updated"), any(Message.class));
        }

        @Test
        @DisplayName("should report zero published for an empty batch")
        void shouldHandleEmptyBatch() {
            PublishResult result = publisher.publishAll(List.of());

            assertThat(result.getStatus()).isEqualTo(PublishResult.Status.PUBLISHED);
            assertThat(result.getPublished()).isZero();
            verifyNoInteractions(rabbitTemplate);
        }
    }

    @Nested
    @DisplayName("Disabled Messaging")
    class DisabledTests {

        @Test
        @DisplayName("should skip without touching the broker")
        void shouldSkipWhenDisabled() {
            properties.getMessaging().setEnabled(false);

            PublishResult result = publisher.publish("shipment.created", contract);

            assertThat(result.getStatus()).isEqualTo(PublishResult.Status.SKIPPED);
            assertThat(result.isSuccess()).isTrue();
            verifyNoInteractions(rabbitTemplate);
        }
    }

    @Nested
    @DisplayName("Failure Handling")
    class FailureTests {

        @Test
        @DisplayName("should report a connection error without resetting the shared connection")
        void shouldReportConnectionError() {
            when(rabbitTemplate.invoke(any()))
                    .thenThrow(new AmqpConnectException(new ConnectException("Connection refused")));
            lenient().when(rabbitTemplate.getConnectionFactory()).thenReturn(connectionFactory);

            PublishResult result = publisher.publish("shipment.created", contract);

            assertThat(result.getStatus()).isEqualTo(PublishResult.Status.CONNECTION_ERROR);
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).contains("Connection refused");
            verify(connectionFactory, never()).resetConnection();
        }

        @Test
        @DisplayName("should report a publish error for channel failures")
        void shouldReportPublishError() {
            when(rabbitTemplate.invoke(any()))
                    .thenThrow(new AmqpIOException(new IOException("channel closed")));
            lenient().when(rabbitTemplate.getConnectionFactory()).thenReturn(connectionFactory);

            PublishResult result = publisher.publish("shipment.created", contract);

            assertThat(result.getStatus()).isEqualTo(PublishResult.Status.PUBLISH_ERROR);
            verify(connectionFactory, never()).resetConnection();
        }

        @Test
        @DisplayName("should keep the listener's connection open when a publish fails")
        void shouldKeepSharedConnectionOpenOnFailure() throws Exception {
            com.rabbitmq.client.ConnectionFactory rabbitFactory = mock(com.rabbitmq.client.ConnectionFactory.class);
            com.rabbitmq.client.Connection rabbitConnection = mock(com.rabbitmq.client.Connection.class);
            lenient().when(rabbitFactory.newConnection((ExecutorService) any(), (String) any()))
                    .thenReturn(rabbitConnection);
            lenient().when(rabbitConnection.isOpen()).thenReturn(true);
            CachingConnectionFactory sharedFactory = new CachingConnectionFactory(rabbitFactory);

            try {
                // The listener container opens its connection first
                Connection consumerConnection = sharedFactory.createConnection();
                assertThat(consumerConnection.isOpen()).isTrue();

                lenient().when(rabbitTemplate.getConnectionFactory()).thenReturn(sharedFactory);
                when(rabbitTemplate.invoke(any()))
                        .thenThrow(new AmqpIOException(new IOException("channel closed")))
                        .thenThrow(new AmqpConnectException(new ConnectException("Connection refused")));

                PublishResult channelFailure = publisher.publish("shipment.created", contract);
                PublishResult connectFailure = publisher.publish("shipment.picked_up", contract);

                assertThat(channelFailure.getStatus()).isEqualTo(PublishResult.Status.PUBLISH_ERROR);
                assertThat(connectFailure.getStatus()).isEqualTo(PublishResult.Status.CONNECTION_ERROR);
                verify(rabbitConnection, never()).close();
                verify(rabbitConnection, never()).close(anyInt());
                assertThat(consumerConnection.isOpen()).isTrue();
                assertThat(sharedFactory.createConnection()).isSameAs(consumerConnection);
            } finally {
                sharedFactory.destroy();
            }
        }

        @Test
        @DisplayName("should report a publish error when the payload cannot be serialized")
        void shouldReportSerializationError() {
            PublishResult result = publisher.publish("shipment.created", new Object());

            assertThat(result.getStatus()).isEqualTo(PublishResult.Status.PUBLISH_ERROR);
            verifyNoInteractions(rabbitTemplate);
        }
    }
}
