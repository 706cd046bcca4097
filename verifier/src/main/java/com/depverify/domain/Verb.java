package com.depverify.domain;

import io.micronaut.serde.annotation.Serdeable;

/** What happened to the subject of a finding. */
@Serdeable
public enum Verb {
    OK,
    ADDED,
    REMOVED,
    CHANGED,
    FAILED
}
