package com.depverify.service.inspection;

import com.depverify.domain.Subpackage;

import java.util.List;

/**
 * Decides whether a before/after pair of builds is a rebase onto a new upstream version.
 *
 * The default production implementation is {@link DefaultRebaseDetector}.
 */
@FunctionalInterface
public interface RebaseDetector {

    boolean isRebase(List<Subpackage> subpackages);
}
