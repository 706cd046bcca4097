package com.depverify.domain;

import io.micronaut.serde.annotation.Serdeable;

/**
 * Remediation advice attached to a finding.
 */
@Serdeable
public enum Remedy {
    MACROS("Dependency version strings contain unexpanded macros. Make sure every macro used in a "
        + "dependency is defined when the spec file is built, or remove the macro."),
    EXPLICIT("Add an explicit 'Requires: NAME = %{version}-%{release}' for the subpackage providing "
        + "the shared library so old and new subpackages are never mixed."),
    EXPLICIT_EPOCH("Add an explicit 'Requires: NAME = %{epoch}:%{version}-%{release}' for the subpackage "
        + "providing the shared library so old and new subpackages are never mixed."),
    MULTIPLE("More than one subpackage provides the same shared library. Move the library into a single "
        + "subpackage or filter the duplicate Provides."),
    EPOCH("The package defines an Epoch greater than zero. Dependencies on the package version and "
        + "release must carry the epoch prefix, for example '%{epoch}:%{version}-%{release}'."),
    GAINED("A dependency was added. Make sure the new dependency is intended."),
    CHANGED("A dependency changed. Make sure the change is intended."),
    LOST("A dependency was removed. Make sure the removal is intended.");

    private final String advice;

    Remedy(String advice) {
        this.advice = advice;
    }

    public String advice() {
        return advice;
    }
}
