package com.depverify.domain;

import io.micronaut.serde.annotation.Serdeable;

/**
 * Finding severity, lowest first. {@link #VERIFY} and {@link #BAD} fail the inspection.
 */
@Serdeable
public enum Severity {
    OK,
    INFO,
    VERIFY,
    BAD;

    public boolean failsInspection() {
        return this == VERIFY || this == BAD;
    }
}
