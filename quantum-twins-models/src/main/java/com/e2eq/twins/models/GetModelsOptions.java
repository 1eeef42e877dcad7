package com.e2eq.twins.models;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

@Data
@Builder
public class GetModelsOptions {
    private boolean includeModelDefinition;

    /**
     * When non-empty only these models and everything they extend are returned.
     */
    @Singular("dependencyFor")
    private List<String> dependenciesFor;

    public static GetModelsOptions all() {
        return GetModelsOptions.builder().build();
    }
}
