package uk.gegc.clubaccess.features.ledger.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.clubaccess.features.ledger.domain.model.PaymentMethod;
import uk.gegc.clubaccess.features.ledger.domain.model.PaymentMethodStatus;

import java.util.Optional;
import java.util.UUID;

public interface PaymentMethodRepository extends JpaRepository<PaymentMethod, UUID> {

    /**
     * Active method resolution: default first, then newest.
     */
    Optional<PaymentMethod> findFirstByUserIdAndStatusOrderByDefaultMethodDescCreatedAtDesc(UUID userId, PaymentMethodStatus status);
}
