package com.demanddna.repository;

import com.demanddna.entity.DailyTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface DailyTransactionRepository extends JpaRepository<DailyTransaction, UUID> {

    List<DailyTransaction> findByEntityInAndTransactionDateBetweenOrderByTransactionDateAsc(
        Collection<String> entities, LocalDate from, LocalDate to);

    @Modifying
    @Query("""
        DELETE FROM DailyTransaction t
        WHERE t.entity IN :entities
          AND t.transactionDate BETWEEN :from AND :to
    """)
    int deleteRange(
        @Param("entities") Collection<String> entities,
        @Param("from") LocalDate from,
        @Param("to") LocalDate to);
}
