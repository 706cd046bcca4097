package com.depverify.service.inspection;

import com.depverify.domain.Finding;

import java.util.List;

/**
 * Outcome of {@link RpmDepsInspector#inspect}: the verdict plus every finding in emission order.
 */
public record InspectionResult(
    boolean passed,
    boolean rebase,
    String specFile,
    List<Finding> findings
) {}
