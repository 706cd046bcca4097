package com.depverify.service.inspection;

import com.depverify.domain.Subpackage;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A build is a rebase when the source package (or the first subpackage if the job has no source
 * package) changed version between the before and after builds.
 *
 * Disabled with {@code rpmdeps.rebase-detection: false}, in which case nothing is a rebase.
 */
@Singleton
public class DefaultRebaseDetector implements RebaseDetector {

    private static final Logger log = LoggerFactory.getLogger(DefaultRebaseDetector.class);

    @Value("${rpmdeps.rebase-detection:true}")
    boolean enabled;

    @Override
    public boolean isRebase(List<Subpackage> subpackages) {
        if (!enabled || subpackages == null || subpackages.isEmpty()) return false;

        Subpackage reference = subpackages.stream()
            .filter(Subpackage::isSource)
            .findFirst()
            .orElse(subpackages.get(0));

        String before = reference.getBeforeVersion();
        if (before == null) return false;

        boolean rebase = !before.equals(reference.getVersion());
        if (rebase) {
            log.debug("Rebase detected on {}: {} -> {}", reference.getName(), before, reference.getVersion());
        }
        return rebase;
    }
}
