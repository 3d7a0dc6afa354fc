package com.shiptrack.shippingservice.repository;

import com.shiptrack.shippingservice.model.Carrier;
import com.shiptrack.shippingservice.model.Shipment;
import com.shiptrack.shippingservice.model.ShipmentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ShipmentRepository extends JpaRepository<Shipment, Long> {

    boolean existsByTrackingNo(String trackingNo);

    Optional<Shipment> findByTrackingNo(String trackingNo);

    List<Shipment> findByOrderIdOrderByCreatedAtDesc(Long orderId);

    // Idempotency check for 'order.confirmed'
    Optional<Shipment> findFirstByOrderIdAndStatusInOrderByCreatedAtDesc(Long orderId,
                                                                        Collection<ShipmentStatus> statuses);

    /**
     * Shipments of an order in the given statuses, locked (SELECT ... FOR UPDATE)
     * so a concurrent status update cannot interleave with the cancellation.
     *
     * Must be called within a @Transactional context.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Shipment s WHERE s.orderId = :orderId AND s.status IN :statuses ORDER BY s.id")
    List<Shipment> findByOrderIdAndStatusInWithLock(@Param("orderId") Long orderId,
                                                    @Param("statuses") Collection<ShipmentStatus> statuses);

    /**
     * Finds a shipment by ID with pessimistic write lock (SELECT ... FOR UPDATE).
     * Status updates are single-row read-modify-write, this keeps them serialized.
     *
     * Must be called within a @Transactional context.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Shipment s WHERE s.id = :id")
    Optional<Shipment> findByIdWithLock(@Param("id") Long id);

    @Query("SELECT s.status AS status, COUNT(s) AS total FROM Shipment s GROUP BY s.status")
    List<StatusCount> countByStatus();

    @Query("SELECT s.carrier AS carrier, COUNT(s) AS total FROM Shipment s GROUP BY s.carrier")
    List<CarrierCount> countByCarrier();

    interface StatusCount {
        ShipmentStatus getStatus();

        long getTotal();
    }

    interface CarrierCount {
        Carrier getCarrier();

        long getTotal();
    }
}
