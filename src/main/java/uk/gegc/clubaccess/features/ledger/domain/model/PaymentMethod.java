package uk.gegc.clubaccess.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "payment_methods")
@Getter
@Setter
public class PaymentMethod {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "provider", nullable = false, length = 32)
    private String provider;

    @Column(name = "provider_token", nullable = false, length = 255)
    private String providerToken;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PaymentMethodStatus status;

    @Column(name = "is_default", nullable = false)
    private boolean defaultMethod;

    @Column(name = "last4", length = 4)
    private String last4;

    @Column(name = "brand", length = 32)
    private String brand;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
