package com.depverify.service.inspection;

import com.depverify.domain.Subpackage;

/**
 * Contract for the per-subpackage dependency checks.
 *
 * Implementations:
 *   UnexpandedMacroCheck   : version strings still holding %{...} macros
 *   ExplicitLibDepsCheck   : shared library Requires backed by an explicit subpackage Requires
 *   EpochPrefixCheck       : version-release references carry the package epoch
 *   DepRuleChangeClassifier: gained / retained / changed / lost rules against the before build
 */
public interface DepRuleCheck {

    /**
     * Check one subpackage, adding findings to the context.
     *
     * @param ctx        the running inspection; other subpackages are reachable through its build
     * @param subpackage the subpackage to check
     * @return           true when no VERIFY or BAD finding was added for this subpackage
     */
    boolean check(InspectionContext ctx, Subpackage subpackage);
}
