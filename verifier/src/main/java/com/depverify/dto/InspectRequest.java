package com.depverify.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Serdeable
@Schema(description = "Request to inspect the dependency rules of a build")
public record InspectRequest(
    @NotEmpty
    @Schema(description = "Subpackages in declaration order")
    @Valid
    List<SubpackageRequest> subpackages,

    @Nullable
    @Schema(description = "Force the rebase decision; detected from the versions when null")
    Boolean rebase
) {}
