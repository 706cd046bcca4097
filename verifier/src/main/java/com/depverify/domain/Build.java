package com.depverify.domain;

import java.util.List;
import java.util.Objects;

/**
 * Everything one inspection looks at: the subpackages of the after build in declaration order,
 * whether a before build exists, and whether the transition is a rebase.
 *
 * Subpackage order is significant: the first subpackage that provides a shared library becomes
 * the candidate provider, so callers must keep a stable order.
 */
public class Build {

    private final List<Subpackage> subpackages;
    private final boolean beforeBuild;
    private final boolean rebase;

    public Build(List<Subpackage> subpackages, boolean beforeBuild, boolean rebase) {
        this.subpackages = List.copyOf(Objects.requireNonNull(subpackages, "subpackages"));
        this.beforeBuild = beforeBuild;
        this.rebase = rebase;
    }

    public List<Subpackage> getSubpackages() { return subpackages; }

    public boolean hasBeforeBuild() { return beforeBuild; }

    public boolean isRebase() { return rebase; }
}
