package com.e2eq.twins.core.config;

import com.e2eq.twins.core.DigitalTwinsClient;
import com.e2eq.twins.core.age.AgeConnector;
import com.e2eq.twins.core.age.GraphInitializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Produces the client options from MicroProfile Config and, given a {@link DataSource}, an
 * AGE-backed {@link DigitalTwinsClient}.
 */
@ApplicationScoped
public class TwinsClientOptionsProducer {
    private static final Logger LOG = Logger.getLogger(TwinsClientOptionsProducer.class);

    @Inject
    @ConfigProperty(name = "quantum.twins.graph-name", defaultValue = TwinsClientOptions.DEFAULT_GRAPH_NAME)
    String graphName;

    @Inject
    @ConfigProperty(name = "quantum.twins.model-cache-expiration", defaultValue = "PT10S")
    Duration modelCacheExpiration;

    @Inject
    @ConfigProperty(name = "quantum.twins.batch.max-size", defaultValue = "100")
    int maxBatchSize;

    @Inject
    @ConfigProperty(name = "quantum.twins.query.default-page-size", defaultValue = "1000")
    int defaultPageSize;

    // Creates the graph and installs its functions on startup when missing
    @Inject
    @ConfigProperty(name = "quantum.twins.initialize-graph", defaultValue = "true")
    boolean initializeGraph;

    @Inject
    DataSource dataSource;

    @Produces
    @ApplicationScoped
    public TwinsClientOptions produceOptions() {
        return TwinsClientOptions.builder()
                .graphName(graphName)
                .modelCacheExpiration(modelCacheExpiration)
                .maxBatchSize(maxBatchSize)
                .defaultPageSize(defaultPageSize)
                .build();
    }

    @Produces
    @ApplicationScoped
    public DigitalTwinsClient produceClient(TwinsClientOptions options) {
        AgeConnector connector = new AgeConnector(dataSource, options.getGraphName());
        if (initializeGraph) {
            new GraphInitializer(connector).initialize();
        }
        LOG.infof("Digital twins client ready on graph %s", options.getGraphName());
        return DigitalTwinsClient.forAge(connector, options);
    }
}
