package com.depverify.service.inspection;

import com.depverify.domain.Build;
import com.depverify.domain.Finding;
import com.depverify.domain.Subpackage;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the dependency inspection over a whole build:
 *
 *   pass 1 → unexpanded macros in every subpackage
 *   pass 2 → explicit library Requires and epoch prefixes, with the whole build as context
 *   pass 3 → before/after classification, only when a before build exists
 *
 * Findings accumulate; no check stops the ones after it. The build passes when no VERIFY or BAD
 * finding was produced, and a passing build gets a single closing OK finding.
 */
@Singleton
public class RpmDepsInspector {

    private static final Logger log = LoggerFactory.getLogger(RpmDepsInspector.class);

    @Inject UnexpandedMacroCheck macroCheck;
    @Inject ExplicitLibDepsCheck libDepsCheck;
    @Inject EpochPrefixCheck epochCheck;
    @Inject DepRuleChangeClassifier changeClassifier;
    @Inject SpecFileLocator specFileLocator;

    public InspectionResult inspect(Build build) {
        Objects.requireNonNull(build, "build");
        List<Subpackage> subpackages = build.getSubpackages();
        InspectionContext ctx = new InspectionContext(build, specFileLocator.locate(subpackages));

        boolean result = true;

        for (Subpackage sub : subpackages) {
            if (!macroCheck.check(ctx, sub)) {
                result = false;
            }
        }

        for (Subpackage sub : subpackages) {
            if (!libDepsCheck.check(ctx, sub)) {
                result = false;
            }
            if (!epochCheck.check(ctx, sub)) {
                result = false;
            }
        }

        if (build.hasBeforeBuild()) {
            for (Subpackage sub : subpackages) {
                if (!changeClassifier.check(ctx, sub)) {
                    result = false;
                }
            }
        }

        if (result) {
            ctx.add(Finding.ok());
        }

        log.info("rpmdeps: {} subpackages, {} findings, rebase={}, passed={}",
            subpackages.size(), ctx.getFindings().size(), build.isRebase(), result);
        return new InspectionResult(result, build.isRebase(), ctx.getSpecFile(), List.copyOf(ctx.getFindings()));
    }
}
