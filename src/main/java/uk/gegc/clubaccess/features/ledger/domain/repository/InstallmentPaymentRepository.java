package uk.gegc.clubaccess.features.ledger.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.clubaccess.features.ledger.domain.model.InstallmentPayment;

import java.util.List;
import java.util.UUID;

public interface InstallmentPaymentRepository extends JpaRepository<InstallmentPayment, UUID> {

    List<InstallmentPayment> findBySubscriptionId(UUID subscriptionId);

    @Modifying
    @Query("DELETE FROM InstallmentPayment i WHERE i.subscriptionId = :subscriptionId")
    int deleteBySubscriptionId(@Param("subscriptionId") UUID subscriptionId);
}
