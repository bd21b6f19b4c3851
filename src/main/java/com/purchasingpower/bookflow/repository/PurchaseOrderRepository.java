package com.purchasingpower.bookflow.repository;

import com.purchasingpower.bookflow.model.store.OrderStatus;
import com.purchasingpower.bookflow.model.store.PurchaseOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for purchase orders.
 */
@Repository
public interface PurchaseOrderRepository extends JpaRepository<PurchaseOrder, Long> {

    /**
     * Find an order only if it belongs to the given user.
     */
    Optional<PurchaseOrder> findByIdAndUserId(Long id, Long userId);

    /**
     * Latest order of a user in the given status (used when no order number is given).
     */
    Optional<PurchaseOrder> findFirstByUserIdAndStatusOrderByIdDesc(Long userId, OrderStatus status);

    /**
     * Latest order of a user whatever its status.
     */
    Optional<PurchaseOrder> findFirstByUserIdOrderByIdDesc(Long userId);
}
