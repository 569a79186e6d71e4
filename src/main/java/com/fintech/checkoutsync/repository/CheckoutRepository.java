package com.fintech.checkoutsync.repository;

import com.fintech.checkoutsync.entity.Checkout;
import com.fintech.checkoutsync.entity.CheckoutState;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for gateway checkouts, with the selection queries used by reconciliation.
 */
@Repository
public interface CheckoutRepository extends JpaRepository<Checkout, Long> {

    /**
     * Next batch of checkouts still open on the gateway, keyed on id.
     * <p>
     * Keyset paging keeps the scan stable while the rows it already visited
     * move into final states and leave the result set.
     *
     * @param finalStates states to exclude
     * @param afterId     last id of the previous batch (0 for the first one)
     * @param pageable    only the page size is used
     */
    @Query("SELECT c FROM Checkout c WHERE c.state NOT IN :finalStates " +
            "AND c.transactionId IS NOT NULL " +
            "AND c.id > :afterId " +
            "ORDER BY c.id ASC")
    List<Checkout> findOpenCheckoutsAfter(
            @Param("finalStates") Collection<CheckoutState> finalStates,
            @Param("afterId") Long afterId,
            Pageable pageable
    );

    /**
     * Open checkouts, for the admin listing.
     */
    Page<Checkout> findByStateNotIn(Collection<CheckoutState> states, Pageable pageable);

    /**
     * Recently created PayPal checkouts in the given state.
     * Authorization can lag settlement by around two days, which bounds the window.
     */
    @Query("SELECT c FROM Checkout c WHERE c.createdAt BETWEEN :since AND :until " +
            "AND c.state = :state " +
            "AND c.paypalEmail IS NOT NULL " +
            "ORDER BY c.id ASC")
    List<Checkout> findRecentWithPaypal(
            @Param("state") CheckoutState state,
            @Param("since") LocalDateTime since,
            @Param("until") LocalDateTime until
    );

    Optional<Checkout> findByTransactionId(String transactionId);

    long countByState(CheckoutState state);

    long countByStateNotIn(Collection<CheckoutState> states);
}
