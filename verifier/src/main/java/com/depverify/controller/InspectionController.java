package com.depverify.controller;

import com.depverify.dto.InspectRequest;
import com.depverify.dto.InspectionResponse;
import com.depverify.service.InspectionService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

@Controller("/api/v1/inspections")
@Validated
@Tag(name = "inspections")
public class InspectionController {

    @Inject
    InspectionService inspectionService;

    @Post("/rpmdeps")
    @Operation(summary = "Inspect the dependency rules of a build")
    public HttpResponse<InspectionResponse> rpmdeps(@Valid @Body InspectRequest req) {
        return HttpResponse.ok(inspectionService.inspect(req));
    }
}
