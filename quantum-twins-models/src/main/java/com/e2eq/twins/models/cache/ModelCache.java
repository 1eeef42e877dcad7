package com.e2eq.twins.models.cache;

import com.e2eq.twins.models.DigitalTwinsModelData;
import com.e2eq.twins.models.dtdl.DtdlInterface;

import java.time.Clock;
import java.time.Duration;

/**
 * The three registry caches, all sharing one expiration: stored models by id, parsed
 * interfaces by id and the model id of each twin by twin id.
 */
public class ModelCache {
    private static final long MAX_ENTRIES = 10_000;

    private final TtlCache<String, DigitalTwinsModelData> models;
    private final TtlCache<String, DtdlInterface> interfaces;
    private final TtlCache<String, String> twinModels;

    public ModelCache(Duration expiration, Clock clock) {
        this.models = new TtlCache<>(expiration, clock, MAX_ENTRIES);
        this.interfaces = new TtlCache<>(expiration, clock, MAX_ENTRIES);
        this.twinModels = new TtlCache<>(expiration, clock, MAX_ENTRIES);
    }

    public TtlCache<String, DigitalTwinsModelData> models() {
        return models;
    }

    public TtlCache<String, DtdlInterface> interfaces() {
        return interfaces;
    }

    public TtlCache<String, String> twinModels() {
        return twinModels;
    }

    public void invalidateModels() {
        models.invalidateAll();
        interfaces.invalidateAll();
    }

    public void invalidateAll() {
        invalidateModels();
        twinModels.invalidateAll();
    }
}
