package com.demanddna.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@SuppressWarnings({"rawtypes", "unchecked"})
class DemandDnaApiIntegrationTest {

    @Autowired TestRestTemplate restTemplate;

    /** Flat monthly Overall and 2022 profiles plus 2022 daily rows that match the trial exactly. */
    private void ingestFlatProfile(String entity) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int month = 1; month <= 12; month++) {
            rows.add(profileRow(entity, "Overall", "MONTHLY", month, 0));
            rows.add(profileRow(entity, "2022", "MONTHLY", month, 0));
        }
        for (int day = 1; day <= 30; day++) {
            rows.add(profileRow(entity, "2022", "DAILY", day, 100));
        }
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/profiles", rows, Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(resp.getBody().get("stored")).isEqualTo(rows.size());
    }

    private static Map<String, Object> profileRow(String entity, String year, String granularity, int period,
                                                  double sessions) {
        Map<String, Object> row = new HashMap<>();
        row.put("entity", entity);
        row.put("yearLabel", year);
        row.put("granularity", granularity);
        row.put("period", period);
        row.put("sessions", sessions);
        row.put("conversions", sessions / 50);
        row.put("revenue", sessions * 2);
        row.put("trafficIndex", 1.0);
        row.put("conversionRateIndex", 1.0);
        row.put("orderValueIndex", 1.0);
        return row;
    }

    private static Map<String, Object> scenarioBody(String entity) {
        Map<String, Object> body = new HashMap<>();
        body.put("entities", List.of(entity));
        body.put("trialStart", "2023-01-01");
        body.put("trialEnd", "2023-01-30");
        body.put("observedSessions", 3000);
        body.put("observedConversions", 60);
        body.put("observedRevenue", 6000);
        body.put("projectionYear", 2023);
        return body;
    }

    private String createScenario(String entity) {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/scenarios", scenarioBody(entity), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(resp.getHeaders().getLocation()).isNotNull();
        return (String) resp.getBody().get("id");
    }

    private static Map<String, Object> stepShock(String start, String end, double lift) {
        return Map.of("type", "shock", "start", start, "end", end, "shape", "STEP", "lift", lift);
    }

    private static double number(Map body, String... path) {
        Object node = body;
        for (String key : path) {
            node = ((Map) node).get(key);
        }
        return ((Number) node).doubleValue();
    }

    @Test
    void projection_flatProfile_calibratesAndAppliesShock() {
        ingestFlatProfile("itest-projection");
        String id = createScenario("itest-projection");

        ResponseEntity<Map> baseline = restTemplate.getForEntity("/api/v1/scenarios/" + id + "/projection", Map.class);
        assertThat(baseline.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(number(baseline.getBody(), "baselineTotals", "sessions")).isCloseTo(36_500.0, within(1e-6));
        assertThat((List) baseline.getBody().get("rows")).hasSize(365);

        ResponseEntity<Map> appended = restTemplate.postForEntity("/api/v1/scenarios/" + id + "/events",
            stepShock("2023-03-01", "2023-03-10", 0.5), Map.class);
        assertThat(appended.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat((List) appended.getBody().get("events")).hasSize(1);

        ResponseEntity<Map> shocked = restTemplate.getForEntity("/api/v1/scenarios/" + id + "/projection", Map.class);
        assertThat(number(shocked.getBody(), "simulationTotals", "sessions")).isCloseTo(37_000.0, within(1e-6));
        assertThat(((Number) shocked.getBody().get("eventCount")).intValue()).isEqualTo(1);
    }

    @Test
    void weights_favourMatchingYear() {
        ingestFlatProfile("itest-weights");
        String id = createScenario("itest-weights");

        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/scenarios/" + id + "/weights", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(number(resp.getBody(), "weights", "2022")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void attribution_returnsMarginalContributionPerEvent() {
        ingestFlatProfile("itest-attribution");
        String id = createScenario("itest-attribution");
        restTemplate.postForEntity("/api/v1/scenarios/" + id + "/events",
            stepShock("2023-02-01", "2023-02-10", 0.5), Map.class);

        Map<String, Object> target = Map.of("metric", "SESSIONS", "value", 40_000,
            "start", "2023-01-01", "end", "2023-12-31");
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/scenarios/" + id + "/attribution",
            target, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map> rows = (List<Map>) resp.getBody().get("rows");
        assertThat(rows).hasSize(1);
        assertThat(number(rows.get(0), "contribution")).isCloseTo(500.0, within(1e-6));
        assertThat(number(resp.getBody(), "gap")).isCloseTo(3_500.0, within(1e-6));
    }

    @Test
    void scenario_missingProfiles_returns422() {
        String id = createScenario("itest-no-profile");

        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/scenarios/" + id + "/projection", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("code")).isEqualTo("PROFILE_DATA_MISSING");
    }

    @Test
    void scenario_emptyEntities_returns422WithFieldErrors() {
        Map<String, Object> body = scenarioBody("x");
        body.put("entities", List.of());

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/scenarios", body, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void scenario_invertedTrial_returns400() {
        Map<String, Object> body = scenarioBody("x");
        body.put("trialStart", "2023-02-01");

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/scenarios", body, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().get("code")).isEqualTo("INVALID_TRIAL_WINDOW");
    }

    @Test
    void scenario_unknownId_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/scenarios/" + UUID.randomUUID(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("code")).isEqualTo("SCENARIO_NOT_FOUND");
    }

    @Test
    void events_unknownType_returns400() {
        String id = createScenario("itest-events");

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/scenarios/" + id + "/events",
            Map.of("type", "meteor", "start", "2023-01-01"), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void events_removeAndClear() {
        String id = createScenario("itest-edit");
        restTemplate.postForEntity("/api/v1/scenarios/" + id + "/events",
            stepShock("2023-04-01", "2023-04-05", 0.2), Map.class);
        restTemplate.postForEntity("/api/v1/scenarios/" + id + "/events",
            Map.of("type", "custom_drag", "targetPeriod", 6, "multiplier", 1.3), Map.class);

        ResponseEntity<Map> removed = restTemplate.exchange("/api/v1/scenarios/" + id + "/events/0",
            HttpMethod.DELETE, null, Map.class);
        assertThat(removed.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map> events = (List<Map>) removed.getBody().get("events");
        assertThat(events).hasSize(1);
        assertThat(events.get(0).get("type")).isEqualTo("custom_drag");

        ResponseEntity<Map> outOfRange = restTemplate.exchange("/api/v1/scenarios/" + id + "/events/5",
            HttpMethod.DELETE, null, Map.class);
        assertThat(outOfRange.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);

        ResponseEntity<Map> cleared = restTemplate.exchange("/api/v1/scenarios/" + id + "/events",
            HttpMethod.DELETE, null, Map.class);
        assertThat((List) cleared.getBody().get("events")).isEmpty();
    }

    @Test
    void requestId_isEchoed() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "trace-42");

        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/scenarios/" + UUID.randomUUID(),
            HttpMethod.GET, new HttpEntity<>(headers), Map.class);

        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-42");
        assertThat(resp.getBody().get("requestId")).isEqualTo("trace-42");
    }

    @Test
    void campaignDefaults_globalRowBecomesEffective() {
        ResponseEntity<Map> saved = restTemplate.exchange("/api/v1/settings/campaign-defaults", HttpMethod.PUT,
            new HttpEntity<>(Map.of("entity", "__all__", "shape", "DELAYED_PEAK", "liftPercent", 35)), Map.class);
        assertThat(saved.getStatusCode()).isEqualTo(HttpStatus.OK);

        ResponseEntity<Map> effective = restTemplate.getForEntity(
            "/api/v1/settings/campaign-defaults/effective?entity=itest-campaign&shape=DELAYED_PEAK", Map.class);
        assertThat(effective.getBody().get("source")).isEqualTo("GLOBAL");
        assertThat(number(effective.getBody(), "liftPercent")).isEqualTo(35.0);

        ResponseEntity<Map> preview = restTemplate.postForEntity("/api/v1/campaigns/preview",
            Map.of("start", "2023-06-01", "end", "2023-06-10", "shape", "STEP", "liftPercent", 20), Map.class);
        assertThat(preview.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(number(preview.getBody(), "peakMultiplier")).isCloseTo(0.2, within(1e-9));
        assertThat((List) preview.getBody().get("points")).hasSize(10);
    }

    @Test
    void signatures_extractSaveInjectDelete() {
        List<Map<String, Object>> transactions = new ArrayList<>();
        for (LocalDate day = LocalDate.of(2022, 11, 1); day.isBefore(LocalDate.of(2022, 12, 15)); day = day.plusDays(1)) {
            boolean spike = day.getMonthValue() == 11 && day.getDayOfMonth() >= 25 && day.getDayOfMonth() <= 27;
            transactions.add(Map.of("entity", "itest-sig", "date", day.toString(),
                "sessions", spike ? 500 : 100, "conversions", spike ? 20 : 2, "revenue", spike ? 2000 : 200));
        }
        ResponseEntity<Map> ingested = restTemplate.postForEntity("/api/v1/transactions", transactions, Map.class);
        assertThat(ingested.getStatusCode()).isEqualTo(HttpStatus.CREATED);

        Map<String, Object> window = Map.of("name", "Black Friday", "entities", List.of("itest-sig"),
            "start", "2022-11-20", "end", "2022-11-30");
        ResponseEntity<Map> extracted = restTemplate.postForEntity("/api/v1/signatures/extract", window, Map.class);
        assertThat(extracted.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(number(extracted.getBody(), "signature", "totalExcess", "sessions")).isCloseTo(1_200.0, within(1e-6));

        ResponseEntity<Map> saved = restTemplate.postForEntity("/api/v1/signatures", window, Map.class);
        assertThat(saved.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        String signatureId = (String) saved.getBody().get("id");

        String scenarioId = createScenario("itest-sig");
        ResponseEntity<Map> injected = restTemplate.postForEntity(
            "/api/v1/scenarios/" + scenarioId + "/signatures/" + signatureId + "/inject",
            Map.of("newStart", "2023-11-20"), Map.class);
        assertThat(injected.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        List<Map> events = (List<Map>) injected.getBody().get("events");
        assertThat(events.get(0).get("type")).isEqualTo("reapplied_shock");
        assertThat(events.get(0).get("mode")).isEqualTo("ABSOLUTE");

        ResponseEntity<Void> deleted = restTemplate.exchange("/api/v1/signatures/" + signatureId,
            HttpMethod.DELETE, null, Void.class);
        assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        ResponseEntity<Map> gone = restTemplate.getForEntity("/api/v1/signatures/" + signatureId, Map.class);
        assertThat(gone.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void signatures_flatWindow_returns422() {
        List<Map<String, Object>> transactions = new ArrayList<>();
        for (int day = 1; day <= 28; day++) {
            transactions.add(Map.of("entity", "itest-flat", "date", LocalDate.of(2022, 2, day).toString(),
                "sessions", 100, "conversions", 2, "revenue", 200));
        }
        restTemplate.postForEntity("/api/v1/transactions", transactions, Map.class);

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/signatures/extract",
            Map.of("entities", List.of("itest-flat"), "start", "2022-02-10", "end", "2022-02-15"), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("code")).isEqualTo("NO_SIGNIFICANT_SHOCK");
    }

    @Test
    void goal_baseYearGrowth_usesYearlyActualsOfEntity() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int month = 1; month <= 12; month++) {
            rows.add(profileRow("itest-goal", "Overall", "MONTHLY", month, 0));
            rows.add(profileRow("itest-goal", "2022", "MONTHLY", month, 100));
        }
        for (int day = 1; day <= 30; day++) {
            rows.add(profileRow("itest-goal", "2022", "DAILY", day, 100));
        }
        restTemplate.postForEntity("/api/v1/profiles", rows, Map.class);
        String id = createScenario("itest-goal");

        ResponseEntity<List> kpis = restTemplate.getForEntity("/api/v1/profiles/itest-goal/yearly-kpis", List.class);
        assertThat(kpis.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(kpis.getBody()).hasSize(1);
        Map y2022 = (Map) kpis.getBody().get(0);
        assertThat(((Number) y2022.get("year")).intValue()).isEqualTo(2022);
        assertThat(number(y2022, "sessions")).isCloseTo(1_200.0, within(1e-9));
        assertThat(number(y2022, "conversionRate")).isCloseTo(0.02, within(1e-9));

        Map<String, Object> goal = Map.of("metric", "SESSIONS", "baseYear", 2022, "growthPercent", 10,
            "start", "2023-01-01", "end", "2023-12-31");
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/scenarios/" + id + "/goal", goal, Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(number(resp.getBody(), "value")).isCloseTo(1_320.0, within(1e-9));
        assertThat(number(resp.getBody(), "baseValue")).isCloseTo(1_200.0, within(1e-9));

        ResponseEntity<Map> missing = restTemplate.postForEntity("/api/v1/scenarios/" + id + "/goal",
            Map.of("metric", "SESSIONS", "baseYear", 2018, "start", "2023-01-01", "end", "2023-12-31"), Map.class);
        assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(missing.getBody().get("code")).isEqualTo("INVALID_GOAL");
    }
}
