package com.depverify.domain;

import io.micronaut.core.annotation.Creator;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

/**
 * One result of the dependency inspection.
 *
 * {@code noun} is a grouping template with literal {@code ${FILE}} and {@code ${ARCH}}
 * placeholders standing for {@code file} and {@code arch}. {@code remedyAdvice} carries the
 * human-readable text of {@code remedy}.
 */
@Serdeable
@Schema(description = "Dependency inspection finding")
public record Finding(
    String header,
    Severity severity,
    WaiverAuth waiverAuth,
    Verb verb,
    @Nullable String message,
    @Nullable String noun,
    @Nullable Remedy remedy,
    @Nullable String file,
    @Nullable String arch,
    @Nullable String remedyAdvice
) {

    public static final String HEADER = "rpmdeps";

    @Creator
    public Finding {
    }

    public Finding(String header, Severity severity, WaiverAuth waiverAuth, Verb verb,
                   @Nullable String message, @Nullable String noun, @Nullable Remedy remedy,
                   @Nullable String file, @Nullable String arch) {
        this(header, severity, waiverAuth, verb, message, noun, remedy, file, arch,
            remedy != null ? remedy.advice() : null);
    }

    public static Finding ok() {
        return new Finding(HEADER, Severity.OK, WaiverAuth.NOT_WAIVABLE, Verb.OK, null, null, null, null, null);
    }

    public boolean failsInspection() {
        return severity.failsInspection();
    }
}
