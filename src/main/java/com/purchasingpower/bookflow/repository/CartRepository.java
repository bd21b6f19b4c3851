package com.purchasingpower.bookflow.repository;

import com.purchasingpower.bookflow.model.store.Cart;
import com.purchasingpower.bookflow.model.store.CartStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CartRepository extends JpaRepository<Cart, Long> {

    /**
     * Find the cart of a user in the given status. At most one cart per user is ACTIVE.
     */
    Optional<Cart> findFirstByUserIdAndStatusOrderByIdDesc(Long userId, CartStatus status);
}
