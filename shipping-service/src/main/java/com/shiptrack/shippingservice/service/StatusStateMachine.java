package com.shiptrack.shippingservice.service;

import com.shiptrack.shippingservice.exception.InvalidStatusTransitionException;
import com.shiptrack.shippingservice.model.ShipmentStatus;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.shiptrack.shippingservice.model.ShipmentStatus.*;

/**
 * Shipment status transition rules.
 *
 * Pure and stateless: no repository access and no side effects, so every caller
 * (status updates, order cancellation) validates against the same table.
 *
 * <pre>
 * PENDING          -> PICKED_UP, CANCELLED
 * PICKED_UP        -> IN_TRANSIT, CANCELLED
 * IN_TRANSIT       -> OUT_FOR_DELIVERY, FAILED
 * OUT_FOR_DELIVERY -> DELIVERED, FAILED
 * FAILED           -> IN_TRANSIT          (retry)
 * DELIVERED, CANCELLED are terminal
 * </pre>
 */
@Component
public class StatusStateMachine {

    private static final Map<ShipmentStatus, Set<ShipmentStatus>> TRANSITIONS = buildTransitions();

    private static Map<ShipmentStatus, Set<ShipmentStatus>> buildTransitions() {
        Map<ShipmentStatus, Set<ShipmentStatus>> transitions = new EnumMap<>(ShipmentStatus.class);
        transitions.put(PENDING, EnumSet.of(PICKED_UP, CANCELLED));
        transitions.put(PICKED_UP, EnumSet.of(IN_TRANSIT, CANCELLED));
        transitions.put(IN_TRANSIT, EnumSet.of(OUT_FOR_DELIVERY, FAILED));
        transitions.put(OUT_FOR_DELIVERY, EnumSet.of(DELIVERED, FAILED));
        transitions.put(FAILED, EnumSet.of(IN_TRANSIT));
        transitions.put(DELIVERED, EnumSet.noneOf(ShipmentStatus.class));
        transitions.put(CANCELLED, EnumSet.noneOf(ShipmentStatus.class));
        return Collections.unmodifiableMap(transitions);
    }

    /**
     * Validates a requested status change.
     * Re-submitting the current status is accepted as a no-op; callers detect it
     * themselves and skip history and publication.
     *
     * @throws InvalidStatusTransitionException if the pair is not in the table
     */
    public void validate(ShipmentStatus current, ShipmentStatus requested) {
        if (!canTransition(current, requested)) {
            throw new InvalidStatusTransitionException(current, requested);
        }
    }

    public boolean canTransition(ShipmentStatus current, ShipmentStatus requested) {
        if (current == null || requested == null) {
            throw new IllegalArgumentException("Status must not be null (current=" + current
                    + ", requested=" + requested + ")");
        }
        return current == requested || TRANSITIONS.get(current).contains(requested);
    }

    public Set<ShipmentStatus> allowedTargets(ShipmentStatus current) {
        return Collections.unmodifiableSet(TRANSITIONS.get(current));
    }

    public boolean isTerminal(ShipmentStatus status) {
        return TRANSITIONS.get(status).isEmpty();
    }
}
