package com.shiptrack.shippingservice.config;

import com.shiptrack.shippingservice.model.Carrier;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "shipping")
public class ShippingProperties {

    @NotNull
    private Carrier defaultCarrier = Carrier.DHL;

    private Messaging messaging = new Messaging();
    private TrackingNumber trackingNumber = new TrackingNumber();

    @Getter
    @Setter
    public static class Messaging {
        /** When false nothing is published and the order event listener does not start. */
        private boolean enabled = true;

        @NotBlank
        private String exchange = "ecommerce_events";

        @NotBlank
        private String queue = "shipping_queue";

        @Min(0)
        private int publishRetries = 1;

        /** How long the listener waits for the in-flight message on shutdown. */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class TrackingNumber {
        @NotBlank
        private String prefix = "TRK";

        @Min(1)
        private int maxAttempts = 50;
    }
}
