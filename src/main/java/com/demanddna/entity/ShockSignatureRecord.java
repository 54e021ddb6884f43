package com.demanddna.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
    name = "shock_signatures",
    indexes = {
        @Index(name = "idx_sig_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShockSignatureRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 500)
    private String entities;

    @Column(name = "origin_start", nullable = false)
    private LocalDate originStart;

    @Column(name = "origin_end", nullable = false)
    private LocalDate originEnd;

    @Column(name = "duration_days", nullable = false)
    private int durationDays;

    @Column(name = "floor_sessions")
    private double floorSessions;

    @Column(name = "floor_conversions")
    private double floorConversions;

    @Column(name = "floor_revenue")
    private double floorRevenue;

    @Column(name = "total_excess_sessions")
    private double totalExcessSessions;

    @Column(name = "total_excess_conversions")
    private double totalExcessConversions;

    @Column(name = "total_excess_revenue")
    private double totalExcessRevenue;

    @Column(name = "organic_conversion_rate")
    private double organicConversionRate;

    @Column(name = "event_conversion_rate")
    private double eventConversionRate;

    @Column(name = "conversion_rate_delta")
    private double conversionRateDelta;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "shock_signature_days", joinColumns = @JoinColumn(name = "signature_id"))
    @OrderColumn(name = "day_offset")
    private List<SignatureDayEntry> days = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "request_id", length = 64)
    private String requestId;
}
