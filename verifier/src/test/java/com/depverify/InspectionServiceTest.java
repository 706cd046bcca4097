package com.depverify;

import com.depverify.domain.Finding;
import com.depverify.domain.Severity;
import com.depverify.domain.Verb;
import com.depverify.dto.DepRuleRequest;
import com.depverify.dto.InspectRequest;
import com.depverify.dto.InspectionResponse;
import com.depverify.dto.SubpackageRequest;
import com.depverify.service.InspectionService;
import com.depverify.service.inspection.RebaseDetector;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@MicronautTest
class InspectionServiceTest {

    @Inject InspectionService service;
    @Inject RebaseDetector rebaseDetector;   // resolves to the mock below

    @MockBean(RebaseDetector.class)
    RebaseDetector mockRebaseDetector() {
        return mock(RebaseDetector.class);
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private SubpackageRequest foo(List<DepRuleRequest> before, List<DepRuleRequest> after) {
        return new SubpackageRequest("foo", "x86_64", null, "2.0", "1", "1.0", before, after, null);
    }

    private DepRuleRequest rule(String kind, String requirement, String operator, String version) {
        return new DepRuleRequest(kind, requirement, operator, version);
    }

    // ── Tests ───────────────────────────────────────────────────────────────

    @Test
    void inspect_linksPeersAndClassifiesChanges() {
        when(rebaseDetector.isRebase(any())).thenReturn(false);
        var req = new InspectRequest(List.of(foo(
            List.of(rule("Requires", "glibc", ">=", "2.34"), rule("Requires", "perl", null, null)),
            List.of(rule("Requires", "glibc", ">=", "2.38"), rule("Requires", "python3", null, null)))),
            null);

        InspectionResponse resp = service.inspect(req);

        assertThat(resp.passed()).isFalse();
        assertThat(resp.rebase()).isFalse();
        assertThat(resp.findings())
            .extracting(Finding::verb)
            .containsExactly(Verb.CHANGED, Verb.ADDED, Verb.REMOVED);
        assertThat(resp.durationMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void inspect_detectedRebase_downgradesChurn() {
        when(rebaseDetector.isRebase(any())).thenReturn(true);
        var req = new InspectRequest(List.of(foo(
            List.of(rule("Requires", "perl", null, null)),
            List.of(rule("Requires", "python3", null, null)))),
            null);

        InspectionResponse resp = service.inspect(req);

        assertThat(resp.passed()).isTrue();
        assertThat(resp.rebase()).isTrue();
        assertThat(resp.findings()).extracting(Finding::severity)
            .containsExactly(Severity.INFO, Severity.INFO, Severity.OK);
    }

    @Test
    void inspect_explicitRebaseFlag_skipsDetection() {
        var req = new InspectRequest(List.of(foo(List.of(), List.of(rule("Requires", "python3", null, null)))), false);

        InspectionResponse resp = service.inspect(req);

        assertThat(resp.rebase()).isFalse();
        verify(rebaseDetector, never()).isRebase(any());
    }

    @Test
    void inspect_noBeforeRules_skipsDiff() {
        when(rebaseDetector.isRebase(any())).thenReturn(false);
        var req = new InspectRequest(List.of(foo(null, List.of(rule("Requires", "python3", null, null)))), null);

        InspectionResponse resp = service.inspect(req);

        assertThat(resp.passed()).isTrue();
        assertThat(resp.findings()).extracting(Finding::severity).containsExactly(Severity.OK);
    }

    @Test
    void inspect_unknownOperator_rejected() {
        var req = new InspectRequest(List.of(foo(null, List.of(rule("Requires", "python3", "=>", "3")))), null);

        assertThatThrownBy(() -> service.inspect(req))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("=>");
    }
}
