package com.kotsin.crossimpact.domain.model;

/**
 * FailureKind - Why a symbol or regression unit could not produce a numeric result.
 *
 * Failures are unit-scoped: one symbol, or one (target, horizon, mode). The batch
 * always continues with the remaining units.
 */
public enum FailureKind {
    /**
     * Fewer than 5 reported levels. Missing levels contribute 0, so this is only counted.
     */
    MISSING_LEVEL_DATA,

    /**
     * Timestamps not strictly increasing within a symbol
     */
    NON_MONOTONIC_TIMESTAMP,

    /**
     * Snapshot violates the level price ordering or carries negative values
     */
    INVALID_SNAPSHOT,

    /**
     * Too few observations for a stable covariance estimate or a well-posed regression
     */
    INSUFFICIENT_HISTORY,

    /**
     * Collinear or rank-deficient regressors
     */
    SINGULAR_DESIGN_MATRIX,

    /**
     * Exception raised while processing one symbol
     */
    UNEXPECTED_ERROR
}
