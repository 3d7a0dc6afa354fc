package com.shiptrack.shippingservice.service;

import com.shiptrack.shippingservice.config.ShippingProperties;
import com.shiptrack.shippingservice.exception.AllocationExhaustedException;
import com.shiptrack.shippingservice.repository.ShipmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Generates tracking numbers of the form TRK + 4 digits (TRK1000..TRK9999).
 *
 * The existence check alone is a check-then-insert race between concurrent creators,
 * so {@link #reserve(Function)} treats check + insert as one reservation: the unique
 * constraint on tracking_no is the arbiter, and a violation means "pick another one".
 * Both kinds of collision count against the same bounded number of attempts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrackingNumberAllocator {

    static final int LOWEST_CODE = 1000;
    static final int HIGHEST_CODE = 9999;

    private final ShipmentRepository shipmentRepository;
    private final ShippingProperties properties;

    /**
     * Returns a tracking number not currently in use.
     *
     * @throws AllocationExhaustedException after max-attempts collisions
     */
    public String allocate() {
        int maxAttempts = properties.getTrackingNumber().getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = nextCandidate();
            if (!shipmentRepository.existsByTrackingNo(candidate)) {
                return candidate;
            }
            log.debug("Tracking number collision: candidate={}, attempt={}", candidate, attempt);
        }
        throw exhausted(maxAttempts);
    }

    /**
     * Allocates a tracking number and hands it to {@code persister}, which must insert it
     * (in its own transaction). A unique-constraint violation from the persister means a
     * concurrent caller took the same value; another candidate is tried.
     *
     * @throws AllocationExhaustedException after max-attempts collisions
     */
    public <T> T reserve(Function<String, T> persister) {
        int maxAttempts = properties.getTrackingNumber().getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = nextCandidate();
            if (shipmentRepository.existsByTrackingNo(candidate)) {
                log.debug("Tracking number collision: candidate={}, attempt={}", candidate, attempt);
                continue;
            }
            try {
                return persister.apply(candidate);
            } catch (DataIntegrityViolationException e) {
                log.warn("Tracking number taken concurrently, retrying: candidate={}, attempt={}",
                        candidate, attempt);
            }
        }
        throw exhausted(maxAttempts);
    }

    private String nextCandidate() {
        int code = ThreadLocalRandom.current().nextInt(LOWEST_CODE, HIGHEST_CODE + 1);
        return properties.getTrackingNumber().getPrefix() + code;
    }

    private AllocationExhaustedException exhausted(int maxAttempts) {
        log.error("Tracking number allocation exhausted after {} attempts", maxAttempts);
        return new AllocationExhaustedException(
                "Could not allocate a free tracking number after " + maxAttempts + " attempts");
    }
}
