package com.demanddna.service;

import com.demanddna.engine.DnaBlender;
import com.demanddna.engine.Granularity;
import com.demanddna.engine.ProfilePoint;
import com.demanddna.engine.PureDna;
import com.demanddna.engine.SimilarityWeighting;
import com.demanddna.engine.TrialObservation;
import com.demanddna.engine.goal.YearlyKpi;
import com.demanddna.exception.ProfileDataMissingException;
import com.demanddna.repository.HistoricalIndexRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

@Slf4j
@Service
@RequiredArgsConstructor
public class DnaService {

    private final HistoricalIndexRepository profileRepository;
    private final SimilarityWeighting similarityWeighting;
    private final DnaBlender dnaBlender;

    @Transactional(readOnly = true)
    public Map<String, Double> weights(ScenarioContext context) {
        TrialObservation trial = context.trial();
        TreeSet<Integer> trialDays = new TreeSet<>();
        for (LocalDate day : trial.days()) {
            trialDays.add(day.getDayOfYear());
        }
        List<ProfilePoint> rows = profileRepository
            .findByEntityInAndGranularityAndPeriodIn(context.entities(), Granularity.DAILY, trialDays)
            .stream()
            .map(ProfileIngestionService::toPoint)
            .toList();
        Map<String, Double> weights = similarityWeighting.weights(rows, context.projectionYear(), trial);
        log.debug("Similarity weights | entities={} | rows={} | weights={}", context.entities(), rows.size(), weights);
        return weights;
    }

    @Transactional(readOnly = true)
    public PureDna pureDna(ScenarioContext context) {
        return pureDna(context, weights(context));
    }

    @Transactional(readOnly = true)
    public PureDna pureDna(ScenarioContext context, Map<String, Double> weights) {
        List<ProfilePoint> monthly = profileRepository
            .findByEntityInAndGranularity(context.entities(), Granularity.MONTHLY)
            .stream()
            .map(ProfileIngestionService::toPoint)
            .toList();
        if (monthly.isEmpty()) {
            throw new ProfileDataMissingException(context.entities());
        }
        return dnaBlender.blend(monthly, weights);
    }

    /**
     * Actual yearly sessions, conversions and revenue of one entity, oldest year first.
     */
    @Transactional(readOnly = true)
    public List<YearlyKpi> yearlyKpis(String entity) {
        List<ProfilePoint> monthly = profileRepository
            .findByEntityInAndGranularity(List.of(entity), Granularity.MONTHLY)
            .stream()
            .map(ProfileIngestionService::toPoint)
            .toList();
        if (monthly.isEmpty()) {
            throw new ProfileDataMissingException(List.of(entity));
        }
        return YearlyKpi.fromMonthly(monthly);
    }

    public double overallWeight() {
        return dnaBlender.getOverallWeight();
    }
}
