package uk.gegc.clubaccess.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "tariffs")
@Getter
@Setter
public class Tariff {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Column(name = "code", nullable = false, length = 64)
    private String code;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "access_days", nullable = false)
    private int accessDays;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price = BigDecimal.ZERO;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    /**
     * Offer identifier on the enrollment provider. Preferred over {@link #enrollmentCode}.
     */
    @Column(name = "enrollment_offer_id", length = 128)
    private String enrollmentOfferId;

    @Column(name = "enrollment_code", length = 128)
    private String enrollmentCode;

    @Column(name = "trial", nullable = false)
    private boolean trial;

    public boolean hasEnrollment() {
        return (enrollmentOfferId != null && !enrollmentOfferId.isBlank())
                || (enrollmentCode != null && !enrollmentCode.isBlank());
    }
}
