package com.depverify.service.inspection;

import com.depverify.domain.DepRule;
import jakarta.inject.Singleton;

import java.util.Objects;

/**
 * Structural equality of two rules: same kind, subject, operator and version.
 */
@Singleton
public class DepRuleMatcher {

    public boolean matches(DepRule a, DepRule b) {
        if (a == null || b == null) return false;
        return a.getKind() == b.getKind()
            && a.getRequirement().equals(b.getRequirement())
            && a.getOperator() == b.getOperator()
            && Objects.equals(a.getVersion(), b.getVersion());
    }
}
