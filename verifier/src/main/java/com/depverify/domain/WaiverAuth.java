package com.depverify.domain;

import io.micronaut.serde.annotation.Serdeable;

/** Who may waive a finding. */
@Serdeable
public enum WaiverAuth {
    NOT_WAIVABLE,
    WAIVABLE_BY_ANYONE
}
