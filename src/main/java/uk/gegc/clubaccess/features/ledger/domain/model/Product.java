package uk.gegc.clubaccess.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Entity
@Table(name = "products")
@Getter
@Setter
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "code", nullable = false, unique = true, length = 64)
    private String code;

    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Club on the community provider. {@code null} when the product has no community component.
     */
    @Column(name = "community_club_id", length = 128)
    private String communityClubId;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    public boolean hasCommunityComponent() {
        return communityClubId != null && !communityClubId.isBlank();
    }
}
