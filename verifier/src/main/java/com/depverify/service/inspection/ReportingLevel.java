package com.depverify.service.inspection;

import com.depverify.domain.Finding;
import com.depverify.domain.Remedy;
import com.depverify.domain.Severity;
import com.depverify.domain.Verb;
import com.depverify.domain.WaiverAuth;

/**
 * Severity and waiver authority of a finding.
 *
 * A rebase turns every dependency churn finding into information nobody needs to waive; outside a
 * rebase the same finding is reported at the caller's failing severity and anyone may waive it.
 */
record ReportingLevel(Severity severity, WaiverAuth waiverAuth) {

    static final ReportingLevel INFO = new ReportingLevel(Severity.INFO, WaiverAuth.NOT_WAIVABLE);

    static ReportingLevel waivable(Severity severity) {
        return new ReportingLevel(severity, WaiverAuth.WAIVABLE_BY_ANYONE);
    }

    static ReportingLevel forChange(boolean rebase, Severity failing) {
        return rebase ? INFO : waivable(failing);
    }

    Finding finding(Verb verb, String message, String noun, Remedy remedy, String file, String arch) {
        return new Finding(Finding.HEADER, severity, waiverAuth, verb, message, noun, remedy, file, arch);
    }
}
