package com.kotsin.crossimpact.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.crossimpact.config.JacksonConfig;
import com.kotsin.crossimpact.domain.model.CrossImpactReport;
import com.kotsin.crossimpact.domain.model.FailureKind;
import com.kotsin.crossimpact.domain.model.FitStatus;
import com.kotsin.crossimpact.domain.model.ImpactMode;
import com.kotsin.crossimpact.domain.model.RegressionResult;
import com.kotsin.crossimpact.domain.model.ReturnConvention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Report Writer Tests")
class AnalysisReportWriterTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = JacksonConfig.createReportMapper();
    private final AnalysisReportWriter writer = new AnalysisReportWriter(mapper);

    @Test
    @DisplayName("Report is written as JSON with ISO durations and explicit failures")
    void testWriteReport() throws IOException {
        Duration h = Duration.ofMinutes(1);
        RegressionResult ok = RegressionResult.builder()
            .targetSymbol("AAA").horizon(h).mode(ImpactMode.CONTEMPORANEOUS).status(FitStatus.OK)
            .observations(30).intercept(0.0).selfCoefficient(2.5).crossCoefficients(Map.of("BBB", 0.1))
            .rSquared(0.42).adjustedRSquared(0.38).crossToSelfRatio(0.04)
            .build();
        RegressionResult failed = RegressionResult.failed("BBB", h, ImpactMode.CONTEMPORANEOUS,
            FailureKind.SINGULAR_DESIGN_MATRIX, "collinear", 30);
        CrossImpactReport report = CrossImpactReport.builder()
            .runId("run-1")
            .generatedAt(Instant.parse("2024-03-01T16:00:00Z"))
            .binWidth(h)
            .horizons(List.of(h))
            .convention(ReturnConvention.PRICE_DIFFERENCE)
            .symbols(List.of("AAA", "BBB"))
            .symbolAnalyses(List.of())
            .regressionResults(List.of(ok, failed))
            .matrices(List.of())
            .build();

        Path target = writer.write(report, dir.resolve("nested/out/report.json"));

        assertTrue(Files.exists(target), "Parent directories are created");
        JsonNode json = mapper.readTree(target.toFile());
        assertEquals("run-1", json.get("runId").asText());
        assertEquals("PT1M", json.get("binWidth").asText());
        assertEquals("2024-03-01T16:00:00Z", json.get("generatedAt").asText());
        assertEquals(1, json.get("failedUnits").asInt());

        JsonNode first = json.get("regressionResults").get(0);
        assertEquals(0.42, first.get("rSquared").asDouble(), 1e-12);
        assertEquals(2.5, first.get("selfCoefficient").asDouble(), 1e-12);
        assertFalse(first.has("ok"));

        JsonNode second = json.get("regressionResults").get(1);
        assertEquals("FAILED", second.get("status").asText());
        assertEquals("SINGULAR_DESIGN_MATRIX", second.get("failureKind").asText());
        assertTrue(second.get("rSquared").isNull());
    }
}
