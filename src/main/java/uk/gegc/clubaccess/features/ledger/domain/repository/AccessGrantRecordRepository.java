package uk.gegc.clubaccess.features.ledger.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantRecord;
import uk.gegc.clubaccess.features.ledger.domain.model.AccessGrantStatus;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface AccessGrantRecordRepository extends JpaRepository<AccessGrantRecord, UUID> {

    List<AccessGrantRecord> findBySubscriptionIdAndStatusIn(UUID subscriptionId, Collection<AccessGrantStatus> statuses);

    List<AccessGrantRecord> findBySubscriptionId(UUID subscriptionId);
}
