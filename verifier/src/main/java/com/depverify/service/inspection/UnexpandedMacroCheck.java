package com.depverify.service.inspection;

import com.depverify.domain.DepRule;
import com.depverify.domain.Remedy;
import com.depverify.domain.Severity;
import com.depverify.domain.Subpackage;
import com.depverify.domain.Verb;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Flags after-build rules whose version still contains an unexpanded macro: a {@code %{}
 * followed somewhere later by {@code }}. An opener with no closer is left alone.
 */
@Singleton
public class UnexpandedMacroCheck implements DepRuleCheck {

    static final String MACRO_OPEN = "%{";
    static final char MACRO_CLOSE = '}';

    private static final ReportingLevel LEVEL = ReportingLevel.waivable(Severity.BAD);

    @Inject
    DepRuleFormatter formatter;

    @Override
    public boolean check(InspectionContext ctx, Subpackage subpackage) {
        boolean result = true;
        String name = subpackage.getName();
        String arch = subpackage.getArch();

        for (DepRule rule : subpackage.getAfterRules()) {
            if (!hasUnexpandedMacro(rule.getVersion())) continue;

            String r = formatter.format(rule);
            ctx.add(LEVEL.finding(Verb.FAILED,
                String.format("Invalid looking %s dependency in the %s package on %s: %s",
                    rule.getKind().label(), name, arch, r),
                String.format("'${FILE}' in %s on ${ARCH}", name),
                Remedy.MACROS, r, arch));
            result = false;
        }
        return result;
    }

    static boolean hasUnexpandedMacro(String version) {
        if (version == null) return false;
        int open = version.indexOf(MACRO_OPEN);
        return open >= 0 && version.indexOf(MACRO_CLOSE, open + MACRO_OPEN.length()) >= 0;
    }
}
