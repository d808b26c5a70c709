package com.kotsin.crossimpact.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;

/**
 * RegressionResult - OLS fit of one (target symbol, horizon, mode) unit.
 *
 * A failed unit keeps its identity fields and carries the failure kind and reason;
 * every numeric field is then null ("undefined", never a placeholder number).
 */
@Value
@Builder
public class RegressionResult {

    String targetSymbol;
    Duration horizon;
    ImpactMode mode;

    FitStatus status;
    FailureKind failureKind;
    String failureReason;

    int observations;
    Double intercept;
    Double selfCoefficient;
    Map<String, Double> crossCoefficients;

    @JsonProperty("rSquared")
    Double rSquared;
    @JsonProperty("adjustedRSquared")
    Double adjustedRSquared;

    /**
     * mean(|cross coefficient|) / |self coefficient|
     */
    Double crossToSelfRatio;

    public static RegressionResult failed(String targetSymbol, Duration horizon, ImpactMode mode,
                                          FailureKind kind, String reason, int observations) {
        return RegressionResult.builder()
            .targetSymbol(targetSymbol)
            .horizon(horizon)
            .mode(mode)
            .status(FitStatus.FAILED)
            .failureKind(kind)
            .failureReason(reason)
            .observations(observations)
            .crossCoefficients(Collections.emptyMap())
            .build();
    }

    @JsonIgnore
    public boolean isOk() {
        return status == FitStatus.OK;
    }
}
