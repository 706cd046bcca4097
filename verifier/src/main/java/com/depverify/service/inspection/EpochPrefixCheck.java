package com.depverify.service.inspection;

import com.depverify.domain.DepRule;
import com.depverify.domain.Remedy;
import com.depverify.domain.Severity;
import com.depverify.domain.Subpackage;
import com.depverify.domain.Verb;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * For packages with an epoch above zero, every rule version that ends in the package's own
 * version-release must start with {@code epoch:}.
 */
@Singleton
public class EpochPrefixCheck implements DepRuleCheck {

    @Inject
    DepRuleFormatter formatter;

    @Override
    public boolean check(InspectionContext ctx, Subpackage subpackage) {
        if (subpackage.getEpoch() == 0 || subpackage.getAfterRules().isEmpty()) return true;

        ReportingLevel level = ReportingLevel.forChange(ctx.isRebase(), Severity.BAD);
        String name = subpackage.getName();
        String arch = subpackage.getArch();
        String verrel = subpackage.versionRelease();
        String epochPrefix = subpackage.getEpoch() + ":";
        boolean result = true;

        for (DepRule rule : subpackage.getAfterRules()) {
            String version = rule.getVersion();
            if (version == null) continue;

            if (version.endsWith(verrel) && !version.startsWith(epochPrefix)) {
                String drs = formatter.format(rule);
                ctx.add(level.finding(Verb.FAILED,
                    String.format("Missing epoch prefix on the version-release in '%s' for %s on %s", drs, name, arch),
                    String.format("'${FILE}' needs epoch in %s on ${ARCH}", name),
                    Remedy.EPOCH, drs, arch));

                if (level.severity().failsInspection()) {
                    result = false;
                }
            }
        }
        return result;
    }
}
