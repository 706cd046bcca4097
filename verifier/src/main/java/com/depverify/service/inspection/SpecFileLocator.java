package com.depverify.service.inspection;

import com.depverify.domain.Subpackage;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;

import java.util.List;

/**
 * Finds the spec file name among the source package files, for use in messages only.
 * Jobs without a source package get a generic label.
 */
@Singleton
public class SpecFileLocator {

    @Value("${rpmdeps.spec-extension:.spec}")
    String specExtension;

    @Value("${rpmdeps.spec-placeholder:the spec file}")
    String placeholder;

    public String locate(List<Subpackage> subpackages) {
        for (Subpackage sub : subpackages) {
            if (!sub.isSource()) continue;
            for (String path : sub.getFiles()) {
                if (path != null && path.endsWith(specExtension)) {
                    int slash = path.lastIndexOf('/');
                    return slash >= 0 ? path.substring(slash + 1) : path;
                }
            }
        }
        return placeholder;
    }
}
