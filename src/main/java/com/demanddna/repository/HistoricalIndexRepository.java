package com.demanddna.repository;

import com.demanddna.engine.Granularity;
import com.demanddna.entity.HistoricalIndexRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface HistoricalIndexRepository extends JpaRepository<HistoricalIndexRecord, UUID> {

    List<HistoricalIndexRecord> findByEntityInAndGranularity(Collection<String> entities, Granularity granularity);

    List<HistoricalIndexRecord> findByEntityInAndGranularityAndPeriodIn(
        Collection<String> entities, Granularity granularity, Collection<Integer> periods);

    @Query("SELECT DISTINCT h.entity FROM HistoricalIndexRecord h ORDER BY h.entity")
    List<String> findDistinctEntities();

    @Modifying
    @Query("DELETE FROM HistoricalIndexRecord h WHERE h.entity IN :entities")
    int deleteByEntities(@Param("entities") Collection<String> entities);
}
