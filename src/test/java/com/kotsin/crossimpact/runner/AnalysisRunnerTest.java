package com.kotsin.crossimpact.runner;

import com.kotsin.crossimpact.config.AnalysisConfig;
import com.kotsin.crossimpact.data.AnalysisReportWriter;
import com.kotsin.crossimpact.data.BookSnapshotSource;
import com.kotsin.crossimpact.domain.model.CrossImpactReport;
import com.kotsin.crossimpact.domain.model.FailureKind;
import com.kotsin.crossimpact.domain.model.ImpactMode;
import com.kotsin.crossimpact.domain.model.RegressionResult;
import com.kotsin.crossimpact.service.CrossImpactAnalysisService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Batch Runner Tests")
class AnalysisRunnerTest {

    @Mock
    private BookSnapshotSource snapshotSource;

    @Mock
    private CrossImpactAnalysisService analysisService;

    @Mock
    private AnalysisReportWriter reportWriter;

    private AnalysisConfig config;
    private AnalysisRunner runner;

    @BeforeEach
    void setUp() {
        config = new AnalysisConfig();
        config.getRunner().setEnabled(true);
        config.getRunner().setSymbols(List.of("AAPL", "MSFT"));
        config.getRunner().setOutputFile("target/test-report.json");
        runner = new AnalysisRunner(config, snapshotSource, analysisService, reportWriter);
    }

    @Test
    @DisplayName("Runs the configured symbols and writes the report to the configured file")
    void testRunWritesReport() throws IOException {
        CrossImpactReport report = report();
        when(analysisService.analyze(snapshotSource, List.of("AAPL", "MSFT"))).thenReturn(report);

        runner.run();

        verify(reportWriter).write(eq(report), eq(Path.of("target/test-report.json")));
    }

    @Test
    @DisplayName("Write failures surface as UncheckedIOException")
    void testWriteFailure() throws IOException {
        when(analysisService.analyze(any(BookSnapshotSource.class), anyList())).thenReturn(report());
        when(reportWriter.write(any(), any())).thenThrow(new IOException("disk full"));

        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> runner.run());
        assertEquals("disk full", e.getCause().getMessage());
    }

    private static CrossImpactReport report() {
        Duration h = Duration.ofMinutes(1);
        return CrossImpactReport.builder()
            .runId("test")
            .symbols(List.of("AAPL", "MSFT"))
            .symbolAnalyses(List.of())
            .regressionResults(List.of(RegressionResult.failed("AAPL", h, ImpactMode.CONTEMPORANEOUS,
                FailureKind.INSUFFICIENT_HISTORY, "no data", 0)))
            .matrices(List.of())
            .build();
    }
}
