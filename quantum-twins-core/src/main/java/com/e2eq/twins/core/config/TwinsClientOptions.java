package com.e2eq.twins.core.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Settings of a {@link com.e2eq.twins.core.DigitalTwinsClient}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TwinsClientOptions {
    public static final String DEFAULT_GRAPH_NAME = "digitaltwins";
    public static final int DEFAULT_MAX_BATCH_SIZE = 100;

    @Builder.Default
    private String graphName = DEFAULT_GRAPH_NAME;

    /** Time-to-live of cached models and twin model ids; zero disables caching. */
    @Builder.Default
    private Duration modelCacheExpiration = Duration.ofSeconds(10);

    @Builder.Default
    private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;

    @Builder.Default
    private int defaultPageSize = 1000;

    public static TwinsClientOptions defaults() {
        return TwinsClientOptions.builder().build();
    }
}
