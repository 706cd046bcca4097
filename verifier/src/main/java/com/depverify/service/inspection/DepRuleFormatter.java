package com.depverify.service.inspection;

import com.depverify.domain.DepOperator;
import com.depverify.domain.DepRule;
import jakarta.inject.Singleton;

/**
 * Renders a rule the way packagers write it, e.g. {@code Requires: foo = 1.0-1}.
 */
@Singleton
public class DepRuleFormatter {

    public String format(DepRule rule) {
        StringBuilder sb = new StringBuilder(rule.getKind().label())
            .append(": ")
            .append(rule.getRequirement());
        if (rule.getOperator() != DepOperator.NONE && rule.getVersion() != null) {
            sb.append(' ').append(rule.getOperator().symbol()).append(' ').append(rule.getVersion());
        }
        return sb.toString();
    }
}
