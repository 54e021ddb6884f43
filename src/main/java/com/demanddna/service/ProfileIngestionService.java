package com.demanddna.service;

import com.demanddna.dto.DailyTransactionRequest;
import com.demanddna.dto.IngestionResponse;
import com.demanddna.dto.ProfileRecordRequest;
import com.demanddna.entity.DailyTransaction;
import com.demanddna.entity.HistoricalIndexRecord;
import com.demanddna.engine.ProfilePoint;
import com.demanddna.repository.DailyTransactionRepository;
import com.demanddna.repository.HistoricalIndexRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Loads historical profiles and raw daily transactions. Entity names are trimmed and
 * lower-cased here so everything downstream sees one spelling per entity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileIngestionService {

    private final HistoricalIndexRepository profileRepository;
    private final DailyTransactionRepository transactionRepository;

    public static String normaliseEntity(String entity) {
        return entity == null ? "" : entity.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Replaces every stored profile row of the entities present in {@code records}.
     */
    @Transactional
    public IngestionResponse ingestProfiles(List<ProfileRecordRequest> records, String requestId) {
        Set<String> entities = new TreeSet<>();
        records.forEach(r -> entities.add(normaliseEntity(r.getEntity())));

        int replaced = profileRepository.deleteByEntities(entities);
        List<HistoricalIndexRecord> saved = profileRepository.saveAll(records.stream().map(this::toEntity).toList());
        log.info("Profiles ingested | stored={} | replaced={} | entities={} | requestId={}",
                 saved.size(), replaced, entities, requestId);
        return IngestionResponse.builder()
            .stored(saved.size())
            .replaced(replaced)
            .entities(List.copyOf(entities))
            .requestId(requestId)
            .build();
    }

    /**
     * Replaces stored transactions of the submitted entities over the submitted date span.
     */
    @Transactional
    public IngestionResponse ingestTransactions(List<DailyTransactionRequest> rows, String requestId) {
        if (rows.isEmpty()) {
            return IngestionResponse.builder().entities(List.of()).requestId(requestId).build();
        }
        Set<String> entities = new TreeSet<>();
        rows.forEach(r -> entities.add(normaliseEntity(r.getEntity())));
        LocalDate from = rows.stream().map(DailyTransactionRequest::getDate).min(Comparator.naturalOrder()).orElseThrow();
        LocalDate to = rows.stream().map(DailyTransactionRequest::getDate).max(Comparator.naturalOrder()).orElseThrow();

        int replaced = transactionRepository.deleteRange(entities, from, to);
        List<DailyTransaction> saved = transactionRepository.saveAll(rows.stream()
            .map(r -> DailyTransaction.builder()
                .entity(normaliseEntity(r.getEntity()))
                .transactionDate(r.getDate())
                .sessions(r.getSessions())
                .conversions(r.getConversions())
                .revenue(r.getRevenue())
                .build())
            .toList());
        log.info("Transactions ingested | stored={} | replaced={} | from={} | to={} | requestId={}",
                 saved.size(), replaced, from, to, requestId);
        return IngestionResponse.builder()
            .stored(saved.size())
            .replaced(replaced)
            .entities(List.copyOf(entities))
            .requestId(requestId)
            .build();
    }

    @Transactional(readOnly = true)
    public List<String> listEntities() {
        return profileRepository.findDistinctEntities();
    }

    static ProfilePoint toPoint(HistoricalIndexRecord r) {
        return new ProfilePoint(r.getEntity(), r.getYearLabel(), r.getGranularity(), r.getPeriod(),
            r.getSessions(), r.getConversions(), r.getRevenue(),
            r.getTrafficIndex(), r.getConversionRateIndex(), r.getOrderValueIndex());
    }

    private HistoricalIndexRecord toEntity(ProfileRecordRequest r) {
        String year = ProfilePoint.OVERALL.equalsIgnoreCase(r.getYearLabel().trim())
            ? ProfilePoint.OVERALL
            : r.getYearLabel().trim();
        return HistoricalIndexRecord.builder()
            .entity(normaliseEntity(r.getEntity()))
            .yearLabel(year)
            .granularity(r.getGranularity())
            .period(r.getPeriod())
            .sessions(r.getSessions())
            .conversions(r.getConversions())
            .revenue(r.getRevenue())
            .conversionRate(r.getConversionRate())
            .orderValue(r.getOrderValue())
            .trafficIndex(r.getTrafficIndex())
            .conversionRateIndex(r.getConversionRateIndex())
            .orderValueIndex(r.getOrderValueIndex())
            .build();
    }
}
