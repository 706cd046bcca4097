package com.depverify;

import com.depverify.domain.Build;
import com.depverify.domain.DepOperator;
import com.depverify.domain.DepRule;
import com.depverify.domain.DepRuleKind;
import com.depverify.domain.Finding;
import com.depverify.domain.Remedy;
import com.depverify.domain.Severity;
import com.depverify.domain.Subpackage;
import com.depverify.domain.Verb;
import com.depverify.domain.WaiverAuth;
import com.depverify.service.inspection.DepRuleChangeClassifier;
import com.depverify.service.inspection.InspectionContext;
import com.depverify.service.inspection.PeerLinker;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@MicronautTest
class DepRuleChangeClassifierTest {

    @Inject DepRuleChangeClassifier classifier;
    @Inject PeerLinker peerLinker;

    // ── Helpers ─────────────────────────────────────────────────────────────

    private Subpackage linked(String name, String arch, List<DepRule> before, List<DepRule> after) {
        peerLinker.link(before, after);
        return new Subpackage(name, arch, 0, "2.0", "1", "1.0", before, after, null);
    }

    private InspectionContext contextFor(boolean rebase, Subpackage... subs) {
        return new InspectionContext(new Build(List.of(subs), true, rebase), "foo.spec");
    }

    private static DepRule requires(String subject, DepOperator op, String version) {
        return DepRule.of(DepRuleKind.REQUIRES, subject, op, version);
    }

    // ── Tests ───────────────────────────────────────────────────────────────

    @Test
    void check_identicalRuleSets_allRetainedAsInfo() {
        Subpackage sub = linked("foo", "x86_64",
            List.of(DepRule.of(DepRuleKind.REQUIRES, "bash"), DepRule.of(DepRuleKind.PROVIDES, "foo")),
            List.of(DepRule.of(DepRuleKind.REQUIRES, "bash"), DepRule.of(DepRuleKind.PROVIDES, "foo")));
        InspectionContext ctx = contextFor(false, sub);

        assertThat(classifier.check(ctx, sub)).isTrue();
        assertThat(ctx.getFindings()).hasSize(2).allSatisfy(f -> {
            assertThat(f.severity()).isEqualTo(Severity.INFO);
            assertThat(f.waiverAuth()).isEqualTo(WaiverAuth.NOT_WAIVABLE);
            assertThat(f.verb()).isEqualTo(Verb.OK);
            assertThat(f.remedy()).isNull();
        });
        assertThat(ctx.getFindings().get(0).message()).isEqualTo("Retained 'Requires: bash' in subpackage foo on x86_64");
        assertThat(ctx.passed()).isTrue();
    }

    @Test
    void check_ruleOnlyInAfterBuild_isGained() {
        Subpackage sub = linked("foo", "x86_64",
            List.of(),
            List.of(DepRule.of(DepRuleKind.REQUIRES, "python3")));
        InspectionContext ctx = contextFor(false, sub);

        assertThat(classifier.check(ctx, sub)).isFalse();
        Finding f = ctx.getFindings().get(0);
        assertThat(f.severity()).isEqualTo(Severity.VERIFY);
        assertThat(f.waiverAuth()).isEqualTo(WaiverAuth.WAIVABLE_BY_ANYONE);
        assertThat(f.verb()).isEqualTo(Verb.ADDED);
        assertThat(f.remedy()).isEqualTo(Remedy.GAINED);
        assertThat(f.message()).isEqualTo("Gained 'Requires: python3' in subpackage foo on x86_64");
        assertThat(f.noun()).isEqualTo("'${FILE}' in foo on ${ARCH}");
    }

    @Test
    void check_ruleOnlyInBeforeBuild_isLost() {
        Subpackage sub = linked("foo", "x86_64",
            List.of(DepRule.of(DepRuleKind.OBSOLETES, "foo-old")),
            List.of());
        InspectionContext ctx = contextFor(false, sub);

        assertThat(classifier.check(ctx, sub)).isFalse();
        Finding f = ctx.getFindings().get(0);
        assertThat(f.verb()).isEqualTo(Verb.REMOVED);
        assertThat(f.remedy()).isEqualTo(Remedy.LOST);
        assertThat(f.severity()).isEqualTo(Severity.VERIFY);
        assertThat(f.message()).isEqualTo("Lost 'Obsoletes: foo-old' in subpackage foo on x86_64");
    }

    @Test
    void check_changedRule_reportedForVerification() {
        Subpackage sub = linked("foo", "x86_64",
            List.of(requires("glibc", DepOperator.GREATER_EQUAL, "2.34")),
            List.of(requires("glibc", DepOperator.GREATER_EQUAL, "2.38")));
        InspectionContext ctx = contextFor(false, sub);

        assertThat(classifier.check(ctx, sub)).isFalse();
        Finding f = ctx.getFindings().get(0);
        assertThat(f.verb()).isEqualTo(Verb.CHANGED);
        assertThat(f.severity()).isEqualTo(Severity.VERIFY);
        assertThat(f.message()).isEqualTo("Changed 'Requires: glibc >= 2.34' to 'Requires: glibc >= 2.38' in subpackage foo on x86_64");
        assertThat(f.noun()).isEqualTo("'Requires: glibc >= 2.34' became '${FILE}' in foo on ${ARCH}");
        assertThat(f.file()).isEqualTo("Requires: glibc >= 2.38");
    }

    @Test
    void check_changedPinToSiblingVersion_isExpected() {
        Subpackage libs = linked("foo-libs", "x86_64", List.of(), List.of());
        Subpackage tools = linked("foo-tools", "x86_64",
            List.of(requires("foo-libs", DepOperator.EQUAL, "1.0-1")),
            List.of(requires("foo-libs", DepOperator.EQUAL, "2.0-1")));
        InspectionContext ctx = contextFor(false, libs, tools);

        assertThat(classifier.check(ctx, tools)).isTrue();
        Finding f = ctx.getFindings().get(0);
        assertThat(f.severity()).isEqualTo(Severity.INFO);
        assertThat(f.waiverAuth()).isEqualTo(WaiverAuth.NOT_WAIVABLE);
        assertThat(f.message()).endsWith("; this is expected");
    }

    @Test
    void check_changedLowerBoundOnSibling_isNotExpected() {
        Subpackage libs = linked("foo-libs", "x86_64", List.of(), List.of());
        Subpackage tools = linked("foo-tools", "x86_64",
            List.of(requires("foo-libs", DepOperator.GREATER_EQUAL, "1.0-1")),
            List.of(requires("foo-libs", DepOperator.GREATER_EQUAL, "2.0-1")));
        InspectionContext ctx = contextFor(false, libs, tools);

        assertThat(classifier.check(ctx, tools)).isFalse();
        assertThat(ctx.getFindings().get(0).severity()).isEqualTo(Severity.VERIFY);
    }

    @Test
    void check_rebase_everyChangeIsInfo() {
        Subpackage sub = linked("foo", "x86_64",
            List.of(requires("glibc", DepOperator.GREATER_EQUAL, "2.34"), DepRule.of(DepRuleKind.REQUIRES, "perl")),
            List.of(requires("glibc", DepOperator.GREATER_EQUAL, "2.38"), DepRule.of(DepRuleKind.REQUIRES, "python3")));
        InspectionContext ctx = contextFor(true, sub);

        assertThat(classifier.check(ctx, sub)).isTrue();
        assertThat(ctx.getFindings())
            .extracting(Finding::verb)
            .containsExactly(Verb.CHANGED, Verb.ADDED, Verb.REMOVED);
        assertThat(ctx.getFindings()).allSatisfy(f -> {
            assertThat(f.severity()).isEqualTo(Severity.INFO);
            assertThat(f.waiverAuth()).isEqualTo(WaiverAuth.NOT_WAIVABLE);
        });
    }

    @Test
    void check_sourcePackage_usesSourceLabelAndChangesAreExpected() {
        Subpackage srpm = linked("foo", "src",
            List.of(DepRule.of(DepRuleKind.REQUIRES, "gcc"), requires("cmake", DepOperator.GREATER_EQUAL, "3.20")),
            List.of(DepRule.of(DepRuleKind.REQUIRES, "gcc"), requires("cmake", DepOperator.GREATER_EQUAL, "3.28")));
        InspectionContext ctx = contextFor(false, srpm);

        assertThat(classifier.check(ctx, srpm)).isTrue();
        assertThat(ctx.getFindings()).extracting(Finding::message).containsExactly(
            "Retained 'Requires: gcc' in source package foo",
            "Changed 'Requires: cmake >= 3.20' to 'Requires: cmake >= 3.28' in source package foo; this is expected");
    }

    @Test
    void check_sourcePackage_gainedAndLostUseSourceLabel() {
        Subpackage srpm = linked("foo", "src",
            List.of(DepRule.of(DepRuleKind.REQUIRES, "autoconf")),
            List.of(DepRule.of(DepRuleKind.REQUIRES, "meson")));
        InspectionContext ctx = contextFor(false, srpm);

        assertThat(classifier.check(ctx, srpm)).isFalse();
        assertThat(ctx.getFindings()).extracting(Finding::message).containsExactly(
            "Gained 'Requires: meson' in source package foo",
            "Lost 'Requires: autoconf' in source package foo");
        assertThat(ctx.getFindings()).extracting(Finding::verb).containsExactly(Verb.ADDED, Verb.REMOVED);
    }
}
