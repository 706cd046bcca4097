package com.depverify.service.inspection;

import com.depverify.domain.DepRule;

import java.util.List;

/**
 * Pairs each before-build rule of a subpackage with its after-build counterpart.
 *
 * The default production implementation is {@link DefaultPeerLinker}.
 */
@FunctionalInterface
public interface PeerLinker {

    /**
     * Link rules across the two lists. Rules left without a counterpart keep an empty peer.
     *
     * @param before rules of the before build (may be empty)
     * @param after  rules of the after build
     */
    void link(List<DepRule> before, List<DepRule> after);
}
