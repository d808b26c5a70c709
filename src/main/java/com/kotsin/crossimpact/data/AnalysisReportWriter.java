package com.kotsin.crossimpact.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.crossimpact.domain.model.CrossImpactReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link CrossImpactReport} as JSON for the reporting/plotting side.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnalysisReportWriter {

    private final ObjectMapper objectMapper;

    public Path write(CrossImpactReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), report);
        log.info("[REPORT] run={} written to {} ({} bytes)", report.getRunId(), target, Files.size(target));
        return target;
    }

    public String toJson(CrossImpactReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }
}
