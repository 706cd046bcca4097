package com.depverify.domain;

import jakarta.annotation.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One package produced by the build: a binary subpackage, or the source package when its
 * architecture is {@value #SOURCE_ARCH}.
 *
 * {@code beforeRules} is null when the subpackage has no counterpart in a prior build.
 */
public class Subpackage {

    public static final String SOURCE_ARCH = "src";

    private final String name;
    private final String arch;
    private final long epoch;
    private final String version;
    private final String release;
    private final String beforeVersion;
    private final List<DepRule> beforeRules;
    private final List<DepRule> afterRules;
    private final List<String> files;

    public Subpackage(String name, String arch, long epoch, String version, String release,
                      @Nullable String beforeVersion,
                      @Nullable List<DepRule> beforeRules,
                      List<DepRule> afterRules,
                      @Nullable List<String> files) {
        if (epoch < 0) {
            throw new IllegalArgumentException("Epoch must not be negative: " + epoch);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.arch = Objects.requireNonNull(arch, "arch");
        this.epoch = epoch;
        this.version = Objects.requireNonNull(version, "version");
        this.release = Objects.requireNonNull(release, "release");
        this.beforeVersion = beforeVersion;
        this.beforeRules = beforeRules != null ? List.copyOf(beforeRules) : null;
        this.afterRules = List.copyOf(Objects.requireNonNull(afterRules, "afterRules"));
        this.files = files != null ? List.copyOf(files) : List.of();
    }

    /** Subpackage without a prior build and without a file list. */
    public Subpackage(String name, String arch, long epoch, String version, String release,
                      List<DepRule> afterRules) {
        this(name, arch, epoch, version, release, null, null, afterRules, null);
    }

    public String getName() { return name; }
    public String getArch() { return arch; }
    public long getEpoch() { return epoch; }
    public String getVersion() { return version; }
    public String getRelease() { return release; }
    @Nullable public String getBeforeVersion() { return beforeVersion; }
    public List<String> getFiles() { return files; }
    public List<DepRule> getAfterRules() { return afterRules; }

    public List<DepRule> getBeforeRules() {
        return beforeRules != null ? beforeRules : Collections.emptyList();
    }

    public boolean hasBeforeRules() {
        return beforeRules != null;
    }

    public boolean isSource() {
        return SOURCE_ARCH.equals(arch);
    }

    /** {@code version-release}. */
    public String versionRelease() {
        return version + "-" + release;
    }

    /** {@code epoch:version-release}, whatever the epoch. */
    public String epochVersionRelease() {
        return epoch + ":" + versionRelease();
    }

    /**
     * The version string another subpackage must use to require exactly this one:
     * {@code version-release} for epoch 0, {@code epoch:version-release} otherwise.
     */
    public String explicitVersion() {
        return epoch > 0 ? epochVersionRelease() : versionRelease();
    }

    @Override
    public String toString() {
        return "Subpackage{" + name + "." + arch + " " + explicitVersion() + "}";
    }
}
