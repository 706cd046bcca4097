package com.depverify.service.inspection;

import com.depverify.domain.DepRule;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BiPredicate;

/**
 * Links rules in two passes: identical rules first, then rules that share kind and subject.
 * Running identical rules first keeps a changed rule from stealing the partner of a retained one
 * when a subject appears more than once.
 */
@Singleton
public class DefaultPeerLinker implements PeerLinker {

    private static final Logger log = LoggerFactory.getLogger(DefaultPeerLinker.class);

    @Inject
    DepRuleMatcher matcher;

    @Override
    public void link(List<DepRule> before, List<DepRule> after) {
        if (before == null || before.isEmpty() || after == null || after.isEmpty()) return;

        int exact = linkPass(before, after, matcher::matches);
        int bySubject = linkPass(before, after, (b, a) ->
            b.getKind() == a.getKind() && b.getRequirement().equals(a.getRequirement()));

        log.debug("Linked {} identical and {} changed rules ({} before, {} after)",
            exact, bySubject, before.size(), after.size());
    }

    private int linkPass(List<DepRule> before, List<DepRule> after, BiPredicate<DepRule, DepRule> same) {
        int linked = 0;
        for (DepRule b : before) {
            if (b.hasPeer()) continue;
            for (DepRule a : after) {
                if (!a.hasPeer() && same.test(b, a)) {
                    b.linkPeer(a);
                    linked++;
                    break;
                }
            }
        }
        return linked;
    }
}
