package com.e2eq.twins.models.dtdl;

import java.util.Optional;

/**
 * Supplies the stored definition of a model referenced but not submitted in a parse batch.
 */
@FunctionalInterface
public interface ModelResolver {
    Optional<String> resolve(String modelId);

    static ModelResolver none() {
        return id -> Optional.empty();
    }
}
