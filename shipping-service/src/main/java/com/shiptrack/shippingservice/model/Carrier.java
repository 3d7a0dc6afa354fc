package com.shiptrack.shippingservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Carrier {
    DHL("DHL"),
    BLUEDART("Bluedart"),
    FEDEX("FedEx"),
    DTDC("DTDC");

    private final String label;

    Carrier(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Carrier fromLabel(String value) {
        return Arrays.stream(values())
                .filter(carrier -> carrier.label.equalsIgnoreCase(value) || carrier.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown carrier: " + value));
    }
}
