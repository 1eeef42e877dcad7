package com.e2eq.twins.core.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TwinsClientOptionsTest {

    @Test
    void testDefaults() {
        TwinsClientOptions options = TwinsClientOptions.defaults();

        assertEquals("digitaltwins", options.getGraphName());
        assertEquals(Duration.ofSeconds(10), options.getModelCacheExpiration());
        assertEquals(100, options.getMaxBatchSize());
        assertEquals(1000, options.getDefaultPageSize());
    }

    @Test
    void testProducerMapsConfiguredValues() {
        TwinsClientOptionsProducer producer = new TwinsClientOptionsProducer();
        producer.graphName = "plant";
        producer.modelCacheExpiration = Duration.ZERO;
        producer.maxBatchSize = 10;
        producer.defaultPageSize = 50;

        TwinsClientOptions options = producer.produceOptions();

        assertEquals("plant", options.getGraphName());
        assertEquals(Duration.ZERO, options.getModelCacheExpiration());
        assertEquals(10, options.getMaxBatchSize());
        assertEquals(50, options.getDefaultPageSize());
    }
}
