package com.demanddna.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.time.LocalDate;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignatureDayEntry {

    @Column(name = "day_date", nullable = false)
    private LocalDate date;

    @Column(name = "excess_sessions")
    private double excessSessions;

    @Column(name = "excess_conversions")
    private double excessConversions;

    @Column(name = "excess_revenue")
    private double excessRevenue;

    @Column(name = "relative_sessions")
    private double relativeSessions;

    @Column(name = "relative_conversions")
    private double relativeConversions;

    @Column(name = "relative_revenue")
    private double relativeRevenue;
}
