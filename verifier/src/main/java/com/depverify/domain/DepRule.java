package com.depverify.domain;

import jakarta.annotation.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One declared dependency rule of a subpackage (Requires, Provides, Conflicts, ...).
 *
 * The owning {@link Subpackage} holds the rule in its before or after rule list. {@code peer}
 * points at the counterpart rule in the other build and is set once by a
 * {@link com.depverify.service.inspection.PeerLinker}. {@code providers} collects the names of
 * subpackages found to satisfy a shared-library Requires while a build is inspected; every
 * provider search starts from an empty set.
 */
public class DepRule {

    private final DepRuleKind kind;
    private final String requirement;
    private final DepOperator operator;
    private final String version;

    private DepRule peer;
    private final Set<String> providers = new LinkedHashSet<>();

    public DepRule(DepRuleKind kind, String requirement, DepOperator operator, @Nullable String version) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.requirement = Objects.requireNonNull(requirement, "requirement");
        this.operator = operator != null ? operator : DepOperator.NONE;
        this.version = version;
    }

    public static DepRule of(DepRuleKind kind, String requirement) {
        return new DepRule(kind, requirement, DepOperator.NONE, null);
    }

    public static DepRule of(DepRuleKind kind, String requirement, DepOperator operator, String version) {
        return new DepRule(kind, requirement, operator, version);
    }

    public DepRuleKind getKind() { return kind; }
    public String getRequirement() { return requirement; }
    public DepOperator getOperator() { return operator; }
    @Nullable public String getVersion() { return version; }
    @Nullable public DepRule getPeer() { return peer; }

    public boolean hasPeer() {
        return peer != null;
    }

    /**
     * Link this rule and {@code other} to each other. Both sides must still be unlinked.
     */
    public void linkPeer(DepRule other) {
        Objects.requireNonNull(other, "other");
        if (this.peer != null || other.peer != null) {
            throw new IllegalStateException("Dependency rule already linked: " + requirement);
        }
        this.peer = other;
        other.peer = this;
    }

    /** Record a subpackage that provides this rule's subject. Duplicate names are kept once. */
    public void addProvider(String subpackageName) {
        providers.add(subpackageName);
    }

    /** Forget the providers recorded by an earlier inspection. */
    public void clearProviders() {
        providers.clear();
    }

    public Set<String> getProviders() {
        return Collections.unmodifiableSet(providers);
    }

    /** Subject with any parenthesized architecture qualifier removed, e.g. {@code foo-libs(x86-64)} to {@code foo-libs}. */
    public String bareRequirement() {
        return stripArchQualifier(requirement);
    }

    public static String stripArchQualifier(String subject) {
        int paren = subject.indexOf('(');
        return paren >= 0 ? subject.substring(0, paren) : subject;
    }

    @Override
    public String toString() {
        return "DepRule{" + kind.label() + ": " + requirement
            + (operator != DepOperator.NONE ? " " + operator.symbol() + " " + version : "") + "}";
    }
}
