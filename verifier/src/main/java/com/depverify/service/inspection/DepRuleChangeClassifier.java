package com.depverify.service.inspection;

import com.depverify.domain.DepRule;
import com.depverify.domain.Remedy;
import com.depverify.domain.Severity;
import com.depverify.domain.Subpackage;
import com.depverify.domain.Verb;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Reports how each dependency rule of a subpackage moved between the before and after builds.
 *
 * After-build rules are gained (no peer), retained (identical peer) or changed (different peer);
 * before-build rules without a peer are lost. Rules must already be linked by a {@link PeerLinker}.
 */
@Singleton
public class DepRuleChangeClassifier implements DepRuleCheck {

    @Inject DepRuleFormatter formatter;
    @Inject DepRuleMatcher matcher;
    @Inject ExpectedChangeOracle oracle;

    @Override
    public boolean check(InspectionContext ctx, Subpackage subpackage) {
        boolean result = true;
        ReportingLevel churn = ReportingLevel.forChange(ctx.isRebase(), Severity.VERIFY);
        String name = subpackage.getName();
        String arch = subpackage.getArch();
        String where = subpackage.isSource()
            ? String.format("in source package %s", name)
            : String.format("in subpackage %s on %s", name, arch);
        String noun = String.format("'${FILE}' in %s on ${ARCH}", name);

        for (DepRule rule : subpackage.getAfterRules()) {
            String drs = formatter.format(rule);
            DepRule peer = rule.getPeer();
            ReportingLevel level;
            Verb verb;
            Remedy remedy;
            String message;
            String ruleNoun = noun;

            if (peer == null) {
                level = churn;
                verb = Verb.ADDED;
                remedy = Remedy.GAINED;
                message = String.format("Gained '%s' %s", drs, where);
            } else if (matcher.matches(rule, peer)) {
                level = ReportingLevel.INFO;
                verb = Verb.OK;
                remedy = null;
                message = String.format("Retained '%s' %s", drs, where);
            } else {
                String pdrs = formatter.format(peer);
                level = churn;
                verb = Verb.CHANGED;
                remedy = Remedy.CHANGED;
                message = String.format("Changed '%s' to '%s' %s", pdrs, drs, where);
                ruleNoun = String.format("'%s' became '${FILE}' in %s on ${ARCH}", pdrs, name);

                if (oracle.isExpected(ctx.getBuild(), subpackage, rule)) {
                    level = ReportingLevel.INFO;
                    message += "; this is expected";
                }
            }

            ctx.add(level.finding(verb, message, ruleNoun, remedy, drs, arch));
            if (level.severity().failsInspection()) {
                result = false;
            }
        }

        for (DepRule rule : subpackage.getBeforeRules()) {
            if (rule.hasPeer()) continue;

            String pdrs = formatter.format(rule);
            ctx.add(churn.finding(Verb.REMOVED,
                String.format("Lost '%s' %s", pdrs, where),
                noun, Remedy.LOST, pdrs, arch));
            if (churn.severity().failsInspection()) {
                result = false;
            }
        }
        return result;
    }
}
