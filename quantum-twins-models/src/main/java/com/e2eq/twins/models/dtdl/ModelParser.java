package com.e2eq.twins.models.dtdl;

import java.util.Collection;
import java.util.Map;

/**
 * Parses DTDL definitions into resolved interfaces.
 */
public interface ModelParser {

    /**
     * Parses the definitions together, so they may reference each other, and fetches any
     * other referenced interface through the resolver.
     *
     * @return every interface involved keyed by id, including those pulled in by the resolver
     * @throws com.e2eq.twins.exceptions.ModelParsingException when a definition is malformed
     *                                                         or a reference cannot be resolved
     */
    Map<String, DtdlInterface> parse(Collection<String> definitions, ModelResolver resolver);
}
