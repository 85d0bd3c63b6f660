package uk.gegc.clubaccess.features.ledger.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.clubaccess.features.ledger.domain.model.Tariff;

import java.util.List;
import java.util.UUID;

public interface TariffRepository extends JpaRepository<Tariff, UUID> {
    List<Tariff> findByProductId(UUID productId);
}
