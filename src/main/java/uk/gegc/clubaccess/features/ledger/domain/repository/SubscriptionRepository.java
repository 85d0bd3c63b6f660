package uk.gegc.clubaccess.features.ledger.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.clubaccess.features.ledger.domain.model.Subscription;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    Optional<Subscription> findByOpenKey(String openKey);

    /**
     * Locks the subscription currently holding the open key, if any.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Subscription s WHERE s.openKey = :openKey")
    Optional<Subscription> findByOpenKeyForUpdate(@Param("openKey") String openKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Subscription s WHERE s.id = :id")
    Optional<Subscription> findByIdForUpdate(@Param("id") UUID id);

    Optional<Subscription> findFirstByOrderIdOrderByCreatedAtDesc(UUID orderId);

    List<Subscription> findByUserIdAndProductIdAndAutoRenewTrueAndIdNot(UUID userId, UUID productId, UUID excludedId);
}
