package com.depverify.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

@Serdeable
@Schema(description = "One subpackage of the after build, with its before-build rules when a prior build exists")
public record SubpackageRequest(
    @NotBlank
    String name,

    @NotBlank
    @Schema(description = "Architecture; 'src' marks the source package", example = "x86_64")
    String arch,

    @Nullable
    @PositiveOrZero
    @Schema(description = "Epoch, 0 when absent")
    Long epoch,

    @NotBlank
    String version,

    @NotBlank
    String release,

    @Nullable
    @Schema(description = "Version of this subpackage in the before build")
    String beforeVersion,

    @Nullable
    @Schema(description = "Dependency rules of the before build; omit when there is no before build")
    @Valid
    List<DepRuleRequest> beforeRules,

    @NotNull
    @Schema(description = "Dependency rules of the after build")
    @Valid
    List<DepRuleRequest> afterRules,

    @Nullable
    @Schema(description = "Files of the after-build package; used to find the spec file name")
    List<String> files
) {}
