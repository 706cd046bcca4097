package com.depverify.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;

@Serdeable
@Schema(description = "One dependency rule as declared in package metadata")
public record DepRuleRequest(
    @NotBlank
    @Schema(description = "Rule kind", example = "Requires")
    String kind,

    @NotBlank
    @Schema(description = "Dependency subject, optionally with an architecture qualifier", example = "libfoo.so.1()(64bit)")
    String requirement,

    @Nullable
    @Schema(description = "Version operator", allowableValues = {"=", "<", "<=", ">", ">="})
    String operator,

    @Nullable
    @Schema(description = "Version string, optionally epoch-prefixed", example = "1:2.0-1")
    String version
) {}
