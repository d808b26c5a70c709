package com.kotsin.crossimpact.domain.model;

public enum FitStatus {
    OK,
    FAILED
}
