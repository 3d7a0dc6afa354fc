package com.shiptrack.shippingservice.repository;

import com.shiptrack.shippingservice.model.ShipmentHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ShipmentHistoryRepository extends JpaRepository<ShipmentHistory, Long> {

    // Newest first; id breaks ties between rows written in the same instant
    List<ShipmentHistory> findByShipmentIdOrderByCreatedAtDescIdDesc(Long shipmentId);

    long countByShipmentId(Long shipmentId);
}
