package com.demanddna.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "daily_transactions",
    indexes = {
        @Index(name = "idx_tx_entity_date", columnList = "entity_name, transaction_date"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "entity_name", nullable = false, length = 100)
    private String entity;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    private double sessions;
    private double conversions;
    private double revenue;
}
