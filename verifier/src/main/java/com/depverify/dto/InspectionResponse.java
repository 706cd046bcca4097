package com.depverify.dto;

import com.depverify.domain.Finding;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Serdeable
@Schema(description = "Dependency inspection result")
public record InspectionResponse(
    boolean passed,
    boolean rebase,
    String specFile,
    List<Finding> findings,
    long durationMs
) {}
