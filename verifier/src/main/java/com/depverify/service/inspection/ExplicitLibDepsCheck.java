package com.depverify.service.inspection;

import com.depverify.domain.DepOperator;
import com.depverify.domain.DepRule;
import com.depverify.domain.DepRuleKind;
import com.depverify.domain.Remedy;
import com.depverify.domain.Severity;
import com.depverify.domain.Subpackage;
import com.depverify.domain.Verb;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Every automatic shared library Requires ({@code lib*}) must be backed by an explicit
 * {@code Requires: provider = [epoch:]version-release} on the subpackage providing the library,
 * and only one subpackage may provide it.
 *
 * Providers are searched over all subpackages in build order. The first subpackage found is the
 * one the explicit Requires must name; all of them are recorded on the rule so duplicates can be
 * reported.
 */
@Singleton
public class ExplicitLibDepsCheck implements DepRuleCheck {

    private static final Logger log = LoggerFactory.getLogger(ExplicitLibDepsCheck.class);

    private static final ReportingLevel LEVEL = ReportingLevel.waivable(Severity.VERIFY);

    @Inject
    DepRuleFormatter formatter;

    @Value("${rpmdeps.shared-lib-prefix:lib}")
    String sharedLibPrefix;

    @Override
    public boolean check(InspectionContext ctx, Subpackage subpackage) {
        boolean result = true;
        String name = subpackage.getName();
        String arch = subpackage.getArch();

        for (DepRule req : subpackage.getAfterRules()) {
            if (!isLibRule(req, DepRuleKind.REQUIRES)) continue;

            Subpackage provider = findProviders(ctx, req);

            if (provider != null && !hasExplicitRequires(subpackage, provider)) {
                String r = formatter.format(req);
                boolean epoch = provider.getEpoch() > 0;
                String rulestr = epoch ? "%{epoch}:%{version}-%{release}" : "%{version}-%{release}";
                String pn = provider.getName();

                ctx.add(LEVEL.finding(Verb.FAILED,
                    String.format("Subpackage %s on %s carries '%s' which comes from subpackage %s but does not "
                        + "carry an explicit package version requirement.  Please add 'Requires: %s = %s' to %s "
                        + "to avoid the need to test interoperability between various combinations of old and "
                        + "new subpackages.", name, arch, r, pn, pn, rulestr, ctx.getSpecFile()),
                    String.format("missing 'Requires: ${FILE} = %s' in %s on ${ARCH}", rulestr, name),
                    epoch ? Remedy.EXPLICIT_EPOCH : Remedy.EXPLICIT, pn, arch));
                result = false;
            }

            if (req.getProviders().size() > 1) {
                String r = formatter.format(req);
                String multiples = String.join(", ", req.getProviders());

                ctx.add(LEVEL.finding(Verb.FAILED,
                    String.format("Multiple subpackages provide '%s': %s", r, multiples),
                    String.format("%s all provide '${FILE}' on ${ARCH}", multiples),
                    Remedy.MULTIPLE, r, arch));
                result = false;
            }
        }
        return result;
    }

    /**
     * Record every subpackage providing the subject of {@code req} and return the first one,
     * or null when nothing in the build provides it.
     */
    private Subpackage findProviders(InspectionContext ctx, DepRule req) {
        Subpackage candidate = null;
        req.clearProviders();

        for (Subpackage peer : ctx.getBuild().getSubpackages()) {
            boolean found = false;
            for (DepRule prov : peer.getAfterRules()) {
                // a package may Provide and Require the same thing
                if (prov == req) continue;
                if (!isLibRule(prov, DepRuleKind.PROVIDES)) continue;

                if (sameLibrary(req.getRequirement(), prov.getRequirement())) {
                    req.addProvider(peer.getName());
                    found = true;
                }
            }
            if (found && candidate == null) {
                candidate = peer;
            }
        }

        if (candidate != null) {
            log.debug("{} provided by {} (all providers: {})", req.getRequirement(), candidate.getName(), req.getProviders());
        }
        return candidate;
    }

    /** Exact match, or match with the architecture qualifier, e.g. {@code (x86-64)}, trimmed from both sides. */
    static boolean sameLibrary(String required, String provided) {
        if (required.equals(provided)) return true;
        if (required.indexOf('(') < 0 && provided.indexOf('(') < 0) return false;
        return DepRule.stripArchQualifier(required).equals(DepRule.stripArchQualifier(provided));
    }

    private boolean hasExplicitRequires(Subpackage subpackage, Subpackage provider) {
        String expected = provider.explicitVersion();
        for (DepRule verify : subpackage.getAfterRules()) {
            if (verify.getKind() != DepRuleKind.REQUIRES || verify.getRequirement().startsWith(sharedLibPrefix)) {
                continue;
            }
            if (verify.getRequirement().equals(provider.getName())
                && verify.getOperator() == DepOperator.EQUAL
                && expected.equals(verify.getVersion())) {
                return true;
            }
        }
        return false;
    }

    private boolean isLibRule(DepRule rule, DepRuleKind kind) {
        return rule.getKind() == kind && rule.getRequirement().startsWith(sharedLibPrefix);
    }
}
