package uk.gegc.clubaccess.features.ledger.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Typed order annotation: where the order came from and what access window was asked for.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderMetadata {

    @Enumerated(EnumType.STRING)
    @Column(name = "source", length = 32)
    private OrderSource source;

    @Column(name = "comment", length = 2000)
    private String comment;

    @Column(name = "requested_access_start")
    private LocalDate requestedAccessStart;

    @Column(name = "requested_access_end")
    private LocalDate requestedAccessEnd;

    @Column(name = "offer_id", length = 128)
    private String offerId;
}
