package com.depverify.service.inspection;

import com.depverify.domain.Build;
import com.depverify.domain.Finding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * State of one inspection run: the build under inspection, the spec file label used in
 * messages, and the findings collected so far. Created per run and never shared.
 */
public class InspectionContext {

    private final Build build;
    private final String specFile;
    private final List<Finding> findings = new ArrayList<>();

    public InspectionContext(Build build, String specFile) {
        this.build = Objects.requireNonNull(build, "build");
        this.specFile = Objects.requireNonNull(specFile, "specFile");
    }

    public Build getBuild() { return build; }

    public boolean isRebase() { return build.isRebase(); }

    public String getSpecFile() { return specFile; }

    public void add(Finding finding) {
        findings.add(finding);
    }

    public List<Finding> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    /** True while no VERIFY or BAD finding has been recorded. */
    public boolean passed() {
        return findings.stream().noneMatch(Finding::failsInspection);
    }
}
