package uk.gegc.clubaccess.features.ledger.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.clubaccess.features.ledger.domain.model.Product;

import java.util.Optional;
import java.util.UUID;

public interface ProductRepository extends JpaRepository<Product, UUID> {
    Optional<Product> findByCode(String code);
}
