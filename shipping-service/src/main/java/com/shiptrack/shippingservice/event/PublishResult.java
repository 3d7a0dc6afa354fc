package com.shiptrack.shippingservice.event;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a publish call. Broker failures are reported as values so the caller,
 * whose state change is already committed, decides whether to retry or log.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PublishResult {

    public enum Status {
        PUBLISHED,
        SKIPPED,          // messaging disabled
        CONNECTION_ERROR, // broker unreachable
        PUBLISH_ERROR     // channel error, serialization error, ...
    }

    private final Status status;
    private final int published;
    private final String error;

    public static PublishResult published(int count) {
        return new PublishResult(Status.PUBLISHED, count, null);
    }

    public static PublishResult skipped() {
        return new PublishResult(Status.SKIPPED, 0, null);
    }

    public static PublishResult connectionError(String error) {
        return new PublishResult(Status.CONNECTION_ERROR, 0, error);
    }

    public static PublishResult publishError(String error) {
        return new PublishResult(Status.PUBLISH_ERROR, 0, error);
    }

    public boolean isSuccess() {
        return status == Status.PUBLISHED || status == Status.SKIPPED;
    }
}
