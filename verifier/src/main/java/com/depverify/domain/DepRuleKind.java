package com.depverify.domain;

import java.util.Locale;

/**
 * Dependency rule tags as they appear in package metadata.
 *
 * Only {@link #REQUIRES} and {@link #PROVIDES} drive the library checks; every other kind is
 * carried through the diff untouched. Tags this tool does not know map to {@link #OTHER}.
 */
public enum DepRuleKind {
    REQUIRES("Requires"),
    PROVIDES("Provides"),
    CONFLICTS("Conflicts"),
    OBSOLETES("Obsoletes"),
    ENHANCES("Enhances"),
    RECOMMENDS("Recommends"),
    SUGGESTS("Suggests"),
    SUPPLEMENTS("Supplements"),
    OTHER("Other");

    private final String label;

    DepRuleKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DepRuleKind fromLabel(String label) {
        if (label == null || label.isBlank()) return OTHER;
        String wanted = label.trim().toLowerCase(Locale.ROOT);
        for (DepRuleKind kind : values()) {
            if (kind.label.toLowerCase(Locale.ROOT).equals(wanted)) {
                return kind;
            }
        }
        return OTHER;
    }
}
