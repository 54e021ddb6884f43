package com.demanddna.entity;

import com.demanddna.engine.ShockShape;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Default lift percentage offered when an analyst adds a campaign of {@code shape} for
 * {@code entity}. The entity {@link #GLOBAL} row is the fallback for every entity.
 */
@Entity
@Table(
    name = "campaign_defaults",
    uniqueConstraints = @UniqueConstraint(name = "uk_campaign_entity_shape", columnNames = {"entity_name", "shape"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CampaignDefault {

    public static final String GLOBAL = "__all__";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "entity_name", nullable = false, length = 100)
    private String entity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ShockShape shape;

    @Column(name = "lift_percent", nullable = false)
    private double liftPercent;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
