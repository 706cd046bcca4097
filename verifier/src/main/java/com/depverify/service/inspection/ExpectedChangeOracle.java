package com.depverify.service.inspection;

import com.depverify.domain.Build;
import com.depverify.domain.DepOperator;
import com.depverify.domain.DepRule;
import com.depverify.domain.Subpackage;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a changed rule is the normal consequence of a version bump rather than a
 * regression. A change is expected when:
 *   - it belongs to the source package, or
 *   - the build is a rebase, or
 *   - the rule is {@code Requires: sibling = [epoch:]version-release} pinning a sibling
 *     subpackage of the same architecture to its current build.
 */
@Singleton
public class ExpectedChangeOracle {

    private static final Logger log = LoggerFactory.getLogger(ExpectedChangeOracle.class);

    public boolean isExpected(Build build, Subpackage owner, DepRule rule) {
        if (owner.isSource()) return true;
        if (build.isRebase()) return true;

        String subject = rule.bareRequirement();
        Subpackage sibling = null;
        for (Subpackage peer : build.getSubpackages()) {
            if (peer.isSource()) continue;
            if (peer.getArch().equals(owner.getArch()) && peer.getName().equals(subject)) {
                sibling = peer;
                break;
            }
        }

        if (sibling == null) return false;

        boolean expected = rule.getOperator() == DepOperator.EQUAL
            && sibling.explicitVersion().equals(rule.getVersion());
        log.debug("Change of {} in {} tracks sibling {}: {}", rule.getRequirement(), owner.getName(),
            sibling.getName(), expected);
        return expected;
    }
}
