package com.depverify.service;

import com.depverify.domain.Build;
import com.depverify.domain.DepOperator;
import com.depverify.domain.DepRule;
import com.depverify.domain.DepRuleKind;
import com.depverify.domain.Subpackage;
import com.depverify.dto.DepRuleRequest;
import com.depverify.dto.InspectRequest;
import com.depverify.dto.InspectionResponse;
import com.depverify.dto.SubpackageRequest;
import com.depverify.service.inspection.InspectionResult;
import com.depverify.service.inspection.PeerLinker;
import com.depverify.service.inspection.RebaseDetector;
import com.depverify.service.inspection.RpmDepsInspector;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an inspection request into a {@link Build}:
 *
 *   request rules → DepRule (unknown kinds become OTHER, unknown operators are rejected)
 *   before/after rules → linked by the {@link PeerLinker}
 *   rebase → the request flag, or the {@link RebaseDetector} when the flag is absent
 *
 * and runs the {@link RpmDepsInspector} over it. A before build exists when any subpackage
 * carries a beforeRules list.
 */
@Singleton
public class InspectionService {

    private static final Logger log = LoggerFactory.getLogger(InspectionService.class);

    @Inject RpmDepsInspector inspector;
    @Inject PeerLinker peerLinker;
    @Inject RebaseDetector rebaseDetector;

    public InspectionResponse inspect(InspectRequest req) {
        long start = System.currentTimeMillis();

        List<Subpackage> subpackages = new ArrayList<>();
        boolean beforeBuild = false;
        for (SubpackageRequest sr : req.subpackages()) {
            Subpackage sub = toSubpackage(sr);
            peerLinker.link(sub.getBeforeRules(), sub.getAfterRules());
            beforeBuild |= sub.hasBeforeRules();
            subpackages.add(sub);
        }

        boolean rebase = req.rebase() != null ? req.rebase() : rebaseDetector.isRebase(subpackages);
        InspectionResult result = inspector.inspect(new Build(subpackages, beforeBuild, rebase));

        long durationMs = System.currentTimeMillis() - start;
        log.info("Inspection of {} subpackages {} in {}ms",
            subpackages.size(), result.passed() ? "PASSED" : "FAILED", durationMs);
        return new InspectionResponse(result.passed(), result.rebase(), result.specFile(),
            result.findings(), durationMs);
    }

    // ── Private helpers ─────────────────────────────────────────────────────

    private Subpackage toSubpackage(SubpackageRequest sr) {
        return new Subpackage(
            sr.name(),
            sr.arch(),
            sr.epoch() != null ? sr.epoch() : 0L,
            sr.version(),
            sr.release(),
            sr.beforeVersion(),
            sr.beforeRules() != null ? toRules(sr.beforeRules()) : null,
            toRules(sr.afterRules()),
            sr.files()
        );
    }

    private List<DepRule> toRules(List<DepRuleRequest> rules) {
        return rules.stream()
            .map(r -> new DepRule(
                DepRuleKind.fromLabel(r.kind()),
                r.requirement(),
                DepOperator.fromSymbol(r.operator()),
                r.version()))
            .toList();
    }
}
