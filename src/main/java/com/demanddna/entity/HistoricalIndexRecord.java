package com.demanddna.entity;

import com.demanddna.engine.Granularity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "historical_index_records",
    indexes = {
        @Index(name = "idx_hist_entity_level", columnList = "entity_name, granularity"),
        @Index(name = "idx_hist_year",         columnList = "year_label"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalIndexRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "entity_name", nullable = false, length = 100)
    private String entity;

    /** Four digit year, or {@code Overall} for the all-time aggregate. */
    @Column(name = "year_label", nullable = false, length = 10)
    private String yearLabel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Granularity granularity;

    @Column(name = "period_index", nullable = false)
    private int period;

    private double sessions;
    private double conversions;
    private double revenue;

    @Column(name = "conversion_rate")
    private double conversionRate;

    @Column(name = "order_value")
    private double orderValue;

    @Column(name = "traffic_index", nullable = false)
    private double trafficIndex;

    @Column(name = "conversion_rate_index", nullable = false)
    private double conversionRateIndex;

    @Column(name = "order_value_index", nullable = false)
    private double orderValueIndex;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
